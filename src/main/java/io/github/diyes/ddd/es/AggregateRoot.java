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
import io.vavr.CheckedConsumer;
import io.vavr.CheckedFunction1;
import io.vavr.control.Try;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of event-sourced aggregates: objects whose whole state is derived from the events they
 * produced.
 *
 * <p>Every state change is split into two phases:
 *
 * <ul>
 *   <li>A command validates the intent against the current state without touching it and either
 *       throws {@link DomainRuleViolationException} or returns the event(s) describing the change.
 *   <li>The kernel applies every returned event through the handler registered in {@link
 *       #eventHandlers()} and appends it to the pending events, so that the caller can persist it.
 * </ul>
 *
 * <p>Because handlers are the only place where the state changes, replaying the same events on a
 * fresh instance always reconstructs the same state, see {@link #replay(Function, Serializable,
 * Iterable)}.
 *
 * <p>Instances are not thread-safe.
 *
 * <p><b>Design note</b>: whichever values are produced by commands and handler tables are provided
 * by aggregate authors and therefore checked with the help of {@link Suspicious} methods.
 *
 * @param <ID> the type of the aggregate identifier
 * @param <EVENT> the common type of the events the aggregate produces, preferably a {@code sealed}
 *     interface
 * @param <AGGREGATE> the type of the concrete aggregate
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract non-sealed class AggregateRoot<
  ID extends Serializable,
  EVENT extends Event,
  AGGREGATE extends AggregateRoot<ID, EVENT, AGGREGATE>
>
extends
        Suspicious
{
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(AggregateRoot.class);

  private final ID aggregateId;
  private final List<EVENT> pendingEvents;
  private long version;

  /**
   * Constructs a new aggregate without any state changes.
   *
   * <p>Subclasses used for rehydration must not produce events in their constructor, founding events
   * belong to a static factory method.
   *
   * @param aggregateId the immutable identifier of the aggregate
   * @throws IllegalArgumentException if the identifier is {@code null}
   */
  protected AggregateRoot(final ID aggregateId) {
    this.aggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate identifier");
    this.pendingEvents = new ArrayList<>();
    this.version = 0L;
  }

  /**
   * @return the immutable identifier of the aggregate
   */
  public final ID aggregateId() {
    return aggregateId;
  }

  /**
   * @return the name of the aggregate type, simple class name by default
   */
  public String aggregateType() {
    return getClass().getSimpleName();
  }

  /**
   * @return the number of durable events the current state is built from
   */
  public final long version() {
    return version;
  }

  /**
   * Moves the version forward, typically after the pending events were persisted.
   *
   * @param version the new version
   * @throws IllegalArgumentException if the new version is lower than the current one
   */
  public final void setVersion(final long version) {
    if (version < this.version) {
      throw new IllegalArgumentException(
          "Version of '%s' cannot decrease from %d to %d"
              .formatted(aggregateId, this.version, version));
    }

    this.version = version;
  }

  /**
   * Declares which handler applies each event.
   *
   * <p>The returned table is expected to be a {@code private static final} constant, so that any
   * error in it is detected when the aggregate class initializes.
   *
   * @return the handler table of this aggregate type
   */
  protected abstract EventHandlers<AGGREGATE, EVENT> eventHandlers();

  /**
   * Runs the command body and applies the returned event.
   *
   * <p>The body must only read the state: if it throws, the state and the pending events are
   * guaranteed to be untouched.
   *
   * @param command validating the intent and returning the event describing the change
   * @param <E> the type of the event
   * @return the applied event
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws IllegalStateException if the command returned {@code null}
   * @throws DomainRuleViolationException if the command rejected the intent
   * @throws EventSourcingConfigurationException if there is no handler for the event
   * @throws EventApplicationException if the handler failed
   */
  protected final <E extends EVENT> E command(final Supplier<E> command) {
    final Supplier<E> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final E event =
        throwIllegalStateIfNull(nonNullCommand.get(), "Event produced by the command");

    produce(List.of(event));
    return event;
  }

  /**
   * Runs the command body and applies every returned event in order.
   *
   * @param command validating the intent and returning the events describing the change, an empty
   *     collection produces nothing
   * @return the applied events
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws IllegalStateException if the command returned {@code null} or a {@code null} event
   * @throws DomainRuleViolationException if the command rejected the intent
   * @throws EventSourcingConfigurationException if there is no handler for any of the events
   * @throws EventApplicationException if any handler failed
   * @see #command(Supplier)
   */
  protected final List<EVENT> commandAll(
      final Supplier<? extends Collection<? extends EVENT>> command) {
    final Supplier<? extends Collection<? extends EVENT>> nonNullCommand =
        throwIllegalArgumentIfNull(command, "Command");
    final Collection<? extends EVENT> events =
        throwIllegalStateIfNull(nonNullCommand.get(), "Events produced by the command");

    return produce(events);
  }

  /**
   * Applies already validated events in order, typically the founding events of a new aggregate.
   *
   * @param events to apply
   * @throws IllegalArgumentException if the array is {@code null}
   * @throws IllegalStateException if any of the events is {@code null}
   * @throws EventSourcingConfigurationException if there is no handler for any of the events
   * @throws EventApplicationException if any handler failed
   */
  @SafeVarargs
  protected final void produceEvents(final EVENT... events) {
    produce(Arrays.asList(throwIllegalArgumentIfNull(events, "Events")));
  }

  /**
   * Applies already validated events in order.
   *
   * @param events to apply
   * @throws IllegalArgumentException if the collection is {@code null}
   * @throws IllegalStateException if any of the events is {@code null}
   * @throws EventSourcingConfigurationException if there is no handler for any of the events
   * @throws EventApplicationException if any handler failed
   * @see #produceEvents(Event[])
   */
  protected final void produceEvents(final Collection<? extends EVENT> events) {
    produce(throwIllegalArgumentIfNull(events, "Events"));
  }

  /**
   * @return an immutable snapshot of the events produced since the last clear, in production order
   */
  public final List<EVENT> pendingEvents() {
    return List.copyOf(pendingEvents);
  }

  /**
   * @return {@code true} if there are events to persist
   */
  public final boolean hasPendingEvents() {
    return !pendingEvents.isEmpty();
  }

  /** Forgets the pending events without touching the state. */
  public final void clearEvents() {
    pendingEvents.clear();
  }

  /**
   * Hands the pending events to the block and clears them when the block exits.
   *
   * @param block consuming the pending events, e.g. appending them to a store
   * @throws IllegalArgumentException if the block is {@code null}
   * @see #flushAndGet(CheckedFunction1)
   */
  public final void flush(final CheckedConsumer<? super List<EVENT>> block) {
    final CheckedConsumer<? super List<EVENT>> nonNullBlock =
        throwIllegalArgumentIfNull(block, "Flush block");

    flushAndGet(
        events -> {
          nonNullBlock.accept(events);
          return null;
        });
  }

  /**
   * Hands the pending events to the block and clears them when the block exits.
   *
   * <p>The handed events are cleared on every exit path: if the block fails, its exception is
   * rethrown unchanged (checked exceptions included) after the events were cleared. Events
   * produced while the block runs are not part of the snapshot and stay pending.
   *
   * @param block consuming the pending events
   * @param <R> the type of the block result
   * @return the block result
   * @throws IllegalArgumentException if the block is {@code null}
   */
  public final <R> R flushAndGet(final CheckedFunction1<? super List<EVENT>, ? extends R> block) {
    final CheckedFunction1<? super List<EVENT>, ? extends R> nonNullBlock =
        throwIllegalArgumentIfNull(block, "Flush block");
    final List<EVENT> events = pendingEvents();

    final Try<R> output;
    try {
      output = Try.of(() -> nonNullBlock.apply(events));
    } finally {
      pendingEvents.subList(0, Math.min(events.size(), pendingEvents.size())).clear();
    }

    output
        .onSuccess(
            ignored ->
                LOGGER.debug("Flushed {} events of '{}'", events.size(), describe()))
        .onFailure(
            cause ->
                LOGGER.debug(
                    "Discarded {} events of '{}' after failed flush: {}",
                    events.size(),
                    describe(),
                    cause.getMessage()));

    return output.get();
  }

  /**
   * Applies historical events without adding them to the pending events, each applied event
   * advances the version by one.
   *
   * <p>No business rule is verified: the events already happened.
   *
   * @param history ordered events previously produced by an aggregate with the same identifier
   * @throws IllegalArgumentException if the history is {@code null}
   * @throws IllegalStateException if any of the events is {@code null}
   * @throws EventSourcingConfigurationException if there is no handler for any of the events
   * @throws EventApplicationException if any handler failed
   */
  public final void applyEvents(final Iterable<? extends EVENT> history) {
    final Iterable<? extends EVENT> nonNullHistory =
        throwIllegalArgumentIfNull(history, "Event history");

    final List<EVENT> events = new ArrayList<>();
    for (EVENT event : nonNullHistory) {
      events.add(throwIllegalStateIfNull(event, "Historical event"));
    }

    final List<BiConsumer<AGGREGATE, EVENT>> handlers = resolveAll(events);
    for (int i = 0; i < events.size(); i++) {
      apply(handlers.get(i), events.get(i));
      version++;
    }

    LOGGER.debug("Replayed {} events of '{}'", events.size(), describe());
  }

  /**
   * Reconstructs an aggregate from its history.
   *
   * <pre>{@code
   * Book book = AggregateRoot.replay(Book::new, isbn, events);
   * }</pre>
   *
   * @param factory creating an aggregate without any state changes, typically a constructor
   *     reference
   * @param aggregateId the identifier of the aggregate
   * @param history ordered events previously produced by the aggregate
   * @param <ID> the type of the aggregate identifier
   * @param <EVENT> the common type of the events
   * @param <AGGREGATE> the type of the concrete aggregate
   * @return the rehydrated aggregate with no pending events
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if the factory returned {@code null}, an aggregate with a
   *     different identifier or an aggregate which already produced events
   * @throws EventSourcingConfigurationException if there is no handler for any of the events
   * @throws EventApplicationException if any handler failed
   */
  @SuppressWarnings("squid:S119")
  // @formatter:off
  public static <
    ID extends Serializable,
    EVENT extends Event,
    AGGREGATE extends AggregateRoot<ID, EVENT, AGGREGATE>
  > AGGREGATE replay(
      final Function<? super ID, ? extends AGGREGATE> factory,
      final ID aggregateId,
      final Iterable<? extends EVENT> history) {
  // @formatter:on
    if (factory == null) {
      throw new IllegalArgumentException("Aggregate factory cannot be null");
    }

    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate identifier cannot be null");
    }

    if (history == null) {
      throw new IllegalArgumentException("Event history cannot be null");
    }

    final AGGREGATE aggregate = factory.apply(aggregateId);
    if (aggregate == null) {
      throw new IllegalStateException("Aggregate produced by the factory cannot be null");
    }

    if (!Objects.equals(aggregateId, aggregate.aggregateId())) {
      throw new IllegalStateException(
          "Aggregate factory returned '%s' instead of '%s'"
              .formatted(aggregate.aggregateId(), aggregateId));
    }

    if (aggregate.hasPendingEvents()) {
      throw new IllegalStateException(
          "Aggregate factory of '%s' produced %d events, use a plain constructor to replay"
              .formatted(aggregate.aggregateType(), aggregate.pendingEvents().size()));
    }

    aggregate.applyEvents(history);
    return aggregate;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", aggregateType() + "[", "]")
        .add("aggregateId=" + aggregateId)
        .add("version=" + version)
        .add("pendingEvents=" + pendingEvents.size())
        .toString();
  }

  private List<EVENT> produce(final Collection<? extends EVENT> events) {
    final List<EVENT> nonNullEvents = new ArrayList<>(events.size());
    for (EVENT event : events) {
      nonNullEvents.add(throwIllegalStateIfNull(event, "Produced event"));
    }

    final List<BiConsumer<AGGREGATE, EVENT>> handlers = resolveAll(nonNullEvents);
    for (int i = 0; i < nonNullEvents.size(); i++) {
      final EVENT event = nonNullEvents.get(i);
      apply(handlers.get(i), event);
      pendingEvents.add(event);
    }

    if (!nonNullEvents.isEmpty()) {
      LOGGER.debug("Produced {} events on '{}'", nonNullEvents.size(), describe());
    }

    return List.copyOf(nonNullEvents);
  }

  private List<BiConsumer<AGGREGATE, EVENT>> resolveAll(final List<EVENT> events) {
    final EventHandlers<AGGREGATE, EVENT> handlers =
        throwIllegalStateIfNull(eventHandlers(), "Event handlers of " + aggregateType());

    final List<BiConsumer<AGGREGATE, EVENT>> resolved = new ArrayList<>(events.size());
    for (EVENT event : events) {
      resolved.add(handlers.resolve(event));
    }

    return resolved;
  }

  private void apply(final BiConsumer<AGGREGATE, EVENT> handler, final EVENT event) {
    Try.run(() -> handler.accept(self(), event))
        .onFailure(
            cause ->
                LOGGER.error(
                    "Failed to apply event '{}' to '{}'", event.eventType(), describe(), cause))
        .getOrElseThrow(
            cause ->
                new EventApplicationException(
                    event.eventType(),
                    "Failed to apply event '%s' to '%s'".formatted(event.eventType(), describe()),
                    cause));
  }

  private String describe() {
    return aggregateType() + "/" + aggregateId;
  }

  @SuppressWarnings("unchecked")
  private AGGREGATE self() {
    return (AGGREGATE) this;
  }
}
