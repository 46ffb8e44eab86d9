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
 * Signals an integrity violation: an event handler failed while applying an event.
 *
 * <p>Handlers are expected to never fail, because all preconditions were verified when the event
 * was produced. Reaching this exception means either a defect in the handler or malformed event data
 * coming from the store - it is deliberately distinct from {@link DomainRuleViolationException}.
 *
 * <p>The failing event is never added to the pending events, however the aggregate state may be
 * partially updated and the instance should be discarded.
 */
public class EventApplicationException extends IllegalStateException {
  @Serial private static final long serialVersionUID = -1538764415270953322L;

  private final String eventType;

  /**
   * @param eventType of the event which failed to be applied
   * @param message the detail message
   * @param cause the failure thrown by the handler
   */
  public EventApplicationException(String eventType, String message, Throwable cause) {
    super(message, cause);
    this.eventType = eventType;
  }

  /**
   * @return the type name of the event which failed to be applied
   */
  public String getEventType() {
    return eventType;
  }
}
