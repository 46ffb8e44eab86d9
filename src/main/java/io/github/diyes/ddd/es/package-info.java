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

/**
 * Defines the kernel of event-sourced aggregates.
 *
 * <p>Here is an example to help explain how the pieces fit together - let's assume that we manage a
 * library catalogue where each book is an aggregate identified by its ISBN:
 *
 * <ul>
 *   <li>A librarian asks a {@code Book} to {@code Borrow Copy}. The command only reads the state:
 *       <ul>
 *         <li>If the copy is unknown or already borrowed, the command throws {@link
 *             io.github.diyes.ddd.es.DomainRuleViolationException} and the book stays as it was.
 *         <li>Otherwise the command returns a {@code CopyBorrowed} event describing what happened.
 *       </ul>
 *   <li>{@link io.github.diyes.ddd.es.AggregateRoot} finds the handler registered for {@code
 *       CopyBorrowed} in the book's {@link io.github.diyes.ddd.es.EventHandlers}, lets it mark the
 *       copy as borrowed and remembers the event as pending.
 *   <li>An {@link io.github.diyes.ddd.es.EventSourcedRepository} flushes the pending events into
 *       the store, so that tomorrow the same book can be rebuilt by replaying {@code BookCreated},
 *       {@code CopyAdded} and {@code CopyBorrowed} through the very same handlers.
 * </ul>
 *
 * <p>Mistakes in wiring handlers are not business problems, they are reported as {@link
 * io.github.diyes.ddd.es.EventSourcingConfigurationException} as early as possible.
 */
package io.github.diyes.ddd.es;
