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

/**
 * Marker interface, denoting that the {@link Event} has a meaning outside the aggregate which
 * produced it - e.g. 'Copy Borrowed' is interesting for a notification service, whereas 'Title
 * Updated' is merely a state change of the book.
 *
 * <p>Both kinds are applied and replayed by the aggregate in exactly the same way, the distinction
 * exists for the collaborators deciding which events to publish.
 */
public interface DomainEvent extends Event {}
