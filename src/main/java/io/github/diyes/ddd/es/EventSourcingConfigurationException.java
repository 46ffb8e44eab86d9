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

package io.github.diyes.ddd.es;

import java.io.Serial;

/**
 * Signals a programming defect in the definition of an aggregate or its events:
 *
 * <ul>
 *   <li>Two handlers registered for the same event class.
 *   <li>An event without a handler, either detected when the handler table is built or when the
 *       event is dispatched.
 *   <li>Two event classes sharing the same type name in one {@link
 *       io.github.diyes.ddd.event.EventTypeRegistry}.
 * </ul>
 *
 * <p>It must never be caught and ignored: an event which cannot be dispatched today cannot be
 * replayed tomorrow.
 */
public class EventSourcingConfigurationException extends IllegalStateException {
  @Serial private static final long serialVersionUID = 5150227316458327290L;

  /**
   * @param message the detail message
   */
  public EventSourcingConfigurationException(String message) {
    super(message);
  }

  /**
   * @param message the detail message
   * @param cause the cause, {@code null} is permitted
   */
  public EventSourcingConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
