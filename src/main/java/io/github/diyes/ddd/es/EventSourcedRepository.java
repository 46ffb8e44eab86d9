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

import io.github.diyes.ddd.event.Event;
import io.vavr.control.Try;
import java.io.Serializable;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} storing aggregates as streams of events.
 *
 * <ul>
 *   <li>{@link #load(Serializable)} replays the stored events on a fresh aggregate.
 *   <li>{@link #save(AggregateRoot)} appends the pending events and advances the aggregate version.
 *   <li>{@link #remove(AggregateRoot)} deletes the stream.
 * </ul>
 *
 * <p>Subclasses only deal with the storage itself. Any exception thrown by them reaches the caller
 * unchanged, checked exceptions included.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <EVENT> the common type of the events
 * @param <AGGREGATE> the type of the aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract non-sealed class EventSourcedRepository<
  ID extends Serializable,
  EVENT extends Event,
  AGGREGATE extends AggregateRoot<ID, EVENT, AGGREGATE>
>
extends
        Suspicious
implements
        Repository<ID, AGGREGATE>
{
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(EventSourcedRepository.class);

  private final Function<? super ID, ? extends AGGREGATE> factory;

  /**
   * @param factory creating an aggregate without any state changes, typically a constructor
   *     reference
   * @throws IllegalArgumentException if the factory is {@code null}
   */
  protected EventSourcedRepository(final Function<? super ID, ? extends AGGREGATE> factory) {
    this.factory = throwIllegalArgumentIfNull(factory, "Aggregate factory");
  }

  /**
   * @param aggregateId of the stream
   * @return all stored events of the stream in order, empty if the stream does not exist
   * @throws Exception if the storage failed
   */
  @SuppressWarnings("squid:S112")
  protected abstract List<? extends EVENT> loadEvents(final ID aggregateId) throws Exception;

  /**
   * @param aggregateId of the stream
   * @param expectedVersion number of events the aggregate was built from, usable for optimistic
   *     concurrency checks
   * @param events to append, never empty
   * @throws Exception if the storage failed
   */
  @SuppressWarnings("squid:S112")
  protected abstract void appendEvents(
      final ID aggregateId, final long expectedVersion, final List<EVENT> events) throws Exception;

  /**
   * @param aggregateId of the stream to delete
   * @throws Exception if the storage failed
   */
  @SuppressWarnings("squid:S112")
  protected abstract void removeEvents(final ID aggregateId) throws Exception;

  /**
   * {@inheritDoc}
   *
   * <p>Appended events are cleared from the aggregate even if appending failed, the aggregate
   * should then be reloaded. Events produced during the append stay pending for the next save.
   *
   * @throws IllegalArgumentException if the aggregate is {@code null}
   */
  @Override
  public final void save(final AGGREGATE aggregate) {
    final AGGREGATE nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");

    nonNullAggregate.flush(
        events -> {
          if (events.isEmpty()) {
            return;
          }

          final long loadedVersion = nonNullAggregate.version();
          appendEvents(nonNullAggregate.aggregateId(), loadedVersion, events);
          nonNullAggregate.setVersion(loadedVersion + events.size());

          LOGGER.debug(
              "Saved {} events of '{}', version {}",
              events.size(),
              nonNullAggregate.aggregateId(),
              nonNullAggregate.version());
        });
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the identifier is {@code null}
   */
  @Override
  public final Optional<AGGREGATE> load(final ID aggregateId) {
    final ID nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate identifier");
    final List<? extends EVENT> history =
        throwIllegalStateIfNull(
            Try.of(() -> loadEvents(nonNullAggregateId)).get(), "Loaded event history");

    if (history.isEmpty()) {
      return Optional.empty();
    }

    return Optional.of(AggregateRoot.replay(factory, nonNullAggregateId, history));
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the aggregate is {@code null}
   */
  @Override
  public final void remove(final AGGREGATE aggregate) {
    final AGGREGATE nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");

    Try.run(() -> removeEvents(nonNullAggregate.aggregateId())).get();
    nonNullAggregate.clearEvents();
  }
}
