/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.diyes.ddd.event;

import java.io.Serializable;

/**
 * Represents an immutable fact which changed the state of an aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s: records are
 * immutable and two records of the same type with the same components are equal, which is exactly
 * what is expected from an event.
 *
 * <p>Events never carry the identifier of the aggregate they belong to - the identifier is stable
 * for the lifetime of the aggregate and is obtained from the aggregate itself.
 *
 * <p>Events are expected to be stored and replayed later, possibly by a newer version of the code -
 * this is the reason this interface extends {@link Serializable} interface.
 *
 * @see DomainEvent
 */
public interface Event extends Serializable {
  /**
   * Defined as {@code eventType()} rather than {@code getEventType()} to stay friendly towards Java
   * {@link Record}s and to be ignored by bean-oriented serializers.
   *
   * @return the stable name of this event type
   * @see #typeNameOf(Class)
   */
  default String eventType() {
    return typeNameOf(getClass());
  }

  /**
   * Resolves the stable name of the event type without an instance at hand.
   *
   * @param eventClass to resolve the name for
   * @return {@link EventType#value()} if the class is annotated, simple class name otherwise
   * @throws IllegalArgumentException if the class is {@code null} or the annotation value is blank
   */
  static String typeNameOf(final Class<? extends Event> eventClass) {
    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    final EventType eventType = eventClass.getAnnotation(EventType.class);
    if (eventType == null) {
      return eventClass.getSimpleName();
    }

    if (eventType.value().isBlank()) {
      throw new IllegalArgumentException(
          "@EventType of '%s' cannot be blank".formatted(eventClass.getName()));
    }

    return eventType.value();
  }
}
