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
 * A specific {@link Exception} to be thrown by a command when the intent violates a business rule,
 * e.g. an empty title or borrowing a copy which is already borrowed.
 *
 * <p>Commands throw it before returning any event, so the aggregate state and its pending events
 * are guaranteed to be unchanged - the caller may correct the input and retry.
 *
 * <p>Event handlers must never throw it: business rules are checked when events are produced, not
 * when they are applied or replayed.
 */
public class DomainRuleViolationException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4262918190427359553L;

  /** Rule violation without a message, prefer the constructors describing the broken rule. */
  public DomainRuleViolationException() {
    super();
  }

  /**
   * @param message naming the broken rule, e.g. {@code "Title cannot be empty"}
   */
  public DomainRuleViolationException(String message) {
    super(message);
  }

  /**
   * @param message naming the broken rule
   * @param cause the failure which revealed the violation, {@code null} is permitted
   */
  public DomainRuleViolationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @param cause the failure which revealed the violation, its description becomes the message
   */
  public DomainRuleViolationException(Throwable cause) {
    super(cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 422;
  }
}
