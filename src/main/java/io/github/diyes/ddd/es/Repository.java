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

import java.io.Serializable;
import java.util.Optional;

/**
 * Storage contract of aggregates, hiding how their state is persisted.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <AGGREGATE> the type of the aggregate
 * @see EventSourcedRepository
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public interface Repository<
  ID extends Serializable,
  AGGREGATE extends AggregateRoot<ID, ?, ?>
> {
// @formatter:on
  /**
   * Persists the changes made to the aggregate since it was loaded or saved.
   *
   * @param aggregate to save
   */
  void save(AGGREGATE aggregate);

  /**
   * @param aggregateId of the aggregate to load
   * @return the aggregate, or {@link Optional#empty()} if it does not exist
   */
  Optional<AGGREGATE> load(ID aggregateId);

  /**
   * Deletes every trace of the aggregate.
   *
   * @param aggregate to remove
   */
  void remove(AGGREGATE aggregate);
}
