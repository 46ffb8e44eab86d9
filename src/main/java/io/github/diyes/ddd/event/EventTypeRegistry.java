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

import io.github.diyes.ddd.es.EventSourcingConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping between stable event type names and {@link Event} classes.
 *
 * <p>Collaborators storing events keep the type name next to the payload, and use this registry to
 * find the class to rebuild the event with before replaying it.
 *
 * <p>Each registry is an independent instance - there is no process-wide registration, so unrelated
 * bounded contexts may reuse the same names.
 *
 * @see Event#typeNameOf(Class)
 * @see EventMapper
 */
public final class EventTypeRegistry {
  private final Map<String, Class<? extends Event>> eventClassesByType;

  private EventTypeRegistry(final Map<String, Class<? extends Event>> eventClassesByType) {
    this.eventClassesByType = Collections.unmodifiableMap(new LinkedHashMap<>(eventClassesByType));
  }

  /**
   * @return a new instance of {@link Builder}
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param eventType to look up
   * @return an {@link Optional} class registered under the given name
   */
  public Optional<Class<? extends Event>> findEventClass(final String eventType) {
    if (eventType == null) {
      return Optional.empty();
    }

    return Optional.ofNullable(eventClassesByType.get(eventType));
  }

  /**
   * @param eventType to look up
   * @return class registered under the given name
   * @throws IllegalArgumentException if nothing is registered under the given name
   */
  public Class<? extends Event> getEventClass(final String eventType) {
    return findEventClass(eventType)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Event type '%s' is not registered".formatted(eventType)));
  }

  /**
   * @return all registered names, in registration order
   */
  public Set<String> getEventTypes() {
    return eventClassesByType.keySet();
  }

  /**
   * @param eventClass to verify
   * @return {@code true} if this exact class is registered
   */
  public boolean isRegistered(final Class<?> eventClass) {
    return eventClassesByType.containsValue(eventClass);
  }

  /** Collects event classes and verifies that their names are unique. */
  public static final class Builder {
    private final Map<String, Class<? extends Event>> eventClassesByType = new LinkedHashMap<>();

    private Builder() {
      // Use EventTypeRegistry.builder()
    }

    /**
     * Registers a single concrete event class.
     *
     * @param eventClass to register
     * @return this builder
     * @throws IllegalArgumentException if the class is {@code null} or not concrete
     * @throws EventSourcingConfigurationException if the name is already taken by another class
     */
    public Builder register(final Class<? extends Event> eventClass) {
      if (eventClass == null) {
        throw new IllegalArgumentException("Event class cannot be null");
      }

      if (!EventClasses.isConcrete(eventClass)) {
        throw new IllegalArgumentException(
            "Event class '%s' must be concrete".formatted(eventClass.getName()));
      }

      final String eventType = Event.typeNameOf(eventClass);
      final Class<? extends Event> existing = eventClassesByType.putIfAbsent(eventType, eventClass);

      if (existing != null && !existing.equals(eventClass)) {
        throw new EventSourcingConfigurationException(
            "Event type '%s' is already registered as '%s', cannot register '%s'"
                .formatted(eventType, existing.getName(), eventClass.getName()));
      }

      return this;
    }

    /**
     * Registers every concrete class of the hierarchy.
     *
     * @param eventClass root of the hierarchy, typically a {@code sealed} interface
     * @return this builder
     * @throws EventSourcingConfigurationException if any of the names is already taken
     * @see EventClasses#concreteSubclassesOf(Class)
     */
    public Builder registerAll(final Class<? extends Event> eventClass) {
      for (Class<? extends Event> concreteClass : EventClasses.concreteSubclassesOf(eventClass)) {
        register(concreteClass);
      }

      return this;
    }

    /**
     * @return a new immutable registry
     */
    public EventTypeRegistry build() {
      return new EventTypeRegistry(eventClassesByType);
    }
  }
}
