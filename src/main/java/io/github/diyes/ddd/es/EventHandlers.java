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
import io.github.diyes.ddd.event.EventClasses;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable table associating each {@link Event} class with the only routine allowed to apply it to
 * an aggregate.
 *
 * <p>The table is meant to be built once per aggregate type and stored in a {@code private static
 * final} field of the aggregate class - this way every configuration error described in {@link
 * EventSourcingConfigurationException} is raised while the class initializes, before any instance
 * exists:
 *
 * <pre>{@code
 * private static final EventHandlers<Book, BookEvent> HANDLERS =
 *     EventHandlers.builder(Book.class, BookEvent.class)
 *         .ignore(BookCreated.class)
 *         .on(BookTitleUpdated.class, Book::onTitleUpdated)
 *         .build();
 * }</pre>
 *
 * <p>When the event type is {@code sealed}, {@link Builder#build()} also verifies that every
 * concrete event class of the hierarchy has a handler, so that an event can never be defined
 * without being wired to a state transition.
 *
 * <p>Handlers are resolved by the exact event class first, then by its superclasses, and finally
 * fall back to the catch-all handler declared with {@link Builder#otherwise(BiConsumer)}, if any.
 *
 * @param <AGGREGATE> the type of the aggregate the handlers mutate
 * @param <EVENT> the common type of the events the aggregate understands
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public final class EventHandlers<
  AGGREGATE,
  EVENT extends Event
> {
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(EventHandlers.class);

  private final Class<AGGREGATE> aggregateClass;
  private final Class<EVENT> eventClass;
  private final Map<Class<? extends EVENT>, BiConsumer<AGGREGATE, EVENT>> handlers;
  private final BiConsumer<AGGREGATE, EVENT> fallback;

  private EventHandlers(final Builder<AGGREGATE, EVENT> builder) {
    this.aggregateClass = builder.aggregateClass;
    this.eventClass = builder.eventClass;
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    this.fallback = builder.fallback;
  }

  /**
   * Starts the declaration of a new table.
   *
   * @param aggregateClass the handlers will mutate
   * @param eventClass the common type of the events, preferably a {@code sealed} interface
   * @param <A> the type of the aggregate
   * @param <E> the common type of the events
   * @return a new instance of {@link Builder}
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static <A, E extends Event> Builder<A, E> builder(
      final Class<A> aggregateClass, final Class<E> eventClass) {
    return new Builder<>(aggregateClass, eventClass);
  }

  /**
   * @return specific aggregate class
   */
  public Class<AGGREGATE> getAggregateClass() {
    return aggregateClass;
  }

  /**
   * @return common type of the supported events
   */
  public Class<EVENT> getEventClass() {
    return eventClass;
  }

  /**
   * @return event classes having an explicitly declared handler
   */
  public Set<Class<? extends EVENT>> getSupportedEventClasses() {
    return handlers.keySet();
  }

  /**
   * @return {@code true} if the catch-all handler was declared
   */
  public boolean hasFallback() {
    return fallback != null;
  }

  /**
   * @param candidate event class to verify
   * @return {@code true} if an event of given class can be applied using this table
   */
  public boolean supports(final Class<?> candidate) {
    return candidate != null
        && eventClass.isAssignableFrom(candidate)
        && lookup(handlers, fallback, candidate).isPresent();
  }

  /**
   * Finds the handler for the event, intended to be invoked by {@link AggregateRoot} only.
   *
   * @param event to find the handler for
   * @return the handler to invoke
   * @throws EventSourcingConfigurationException if there is no handler for the event
   */
  BiConsumer<AGGREGATE, EVENT> resolve(final EVENT event) {
    return lookup(handlers, fallback, event.getClass())
        .orElseThrow(
            () ->
                new EventSourcingConfigurationException(
                    "'%s' has no handler for event '%s' (%s)"
                        .formatted(
                            aggregateClass.getSimpleName(),
                            event.eventType(),
                            event.getClass().getName())));
  }

  @SuppressWarnings("squid:S119")
  private static <AGGREGATE, EVENT> Optional<BiConsumer<AGGREGATE, EVENT>> lookup(
      final Map<? extends Class<?>, BiConsumer<AGGREGATE, EVENT>> handlers,
      final BiConsumer<AGGREGATE, EVENT> fallback,
      final Class<?> candidate) {
    for (Class<?> current = candidate; current != null; current = current.getSuperclass()) {
      final BiConsumer<AGGREGATE, EVENT> handler = handlers.get(current);
      if (handler != null) {
        return Optional.of(handler);
      }
    }

    return Optional.ofNullable(fallback);
  }

  /**
   * Collects handlers and verifies that the table is consistent.
   *
   * <p>Every registration mistake is reported immediately as {@link
   * EventSourcingConfigurationException}, the builder does not attempt to recover from it.
   *
   * @param <A> the type of the aggregate
   * @param <E> the common type of the events
   */
  public static final class Builder<A, E extends Event> extends Suspicious {
    private final Class<A> aggregateClass;
    private final Class<E> eventClass;
    private final Map<Class<? extends E>, BiConsumer<A, E>> handlers = new LinkedHashMap<>();
    private final Set<Class<?>> overridable = new HashSet<>();
    private BiConsumer<A, E> fallback;
    private boolean fallbackDeclared;

    private Builder(final Class<A> aggregateClass, final Class<E> eventClass) {
      this.aggregateClass = throwIllegalArgumentIfNull(aggregateClass, "Aggregate class");
      this.eventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    }

    /**
     * Declares the routine applying events of the given class.
     *
     * @param type of the event, must be a class - handlers are resolved along the class hierarchy
     * @param handler mutating the aggregate state, must never fail
     * @param <T> the type of the event
     * @return this builder
     * @throws IllegalArgumentException if any of the arguments is {@code null}
     * @throws EventSourcingConfigurationException if the class already has a handler or if it is an
     *     interface
     */
    public <T extends E> Builder<A, E> on(
        final Class<T> type, final BiConsumer<? super A, ? super T> handler) {
      final Class<T> nonNullType = verifyType(type);
      final BiConsumer<? super A, ? super T> nonNullHandler =
          throwIllegalArgumentIfNull(handler, "Event handler");

      if (handlers.containsKey(nonNullType)) {
        throw new EventSourcingConfigurationException(
            "'%s' already declares a handler for event '%s'"
                .formatted(aggregateClass.getSimpleName(), nonNullType.getName()));
      }

      handlers.put(nonNullType, adapt(nonNullType, nonNullHandler));
      return this;
    }

    /**
     * Declares that events of the given class do not change the state, which is typical for marker
     * events such as 'Created'.
     *
     * @param type of the event
     * @return this builder
     * @throws EventSourcingConfigurationException if the class already has a handler
     */
    public Builder<A, E> ignore(final Class<? extends E> type) {
      return on(type, (aggregate, event) -> {});
    }

    /**
     * Copies all handlers of another table, typically the table of the parent aggregate type.
     *
     * <p>Copied handlers can be replaced with {@link #override(Class, BiConsumer)}.
     *
     * @param parent table to copy the handlers from
     * @return this builder
     * @throws IllegalArgumentException if the parent table is {@code null}
     * @throws EventSourcingConfigurationException if any of the classes already has a handler
     */
    public Builder<A, E> inherit(final EventHandlers<? super A, E> parent) {
      final EventHandlers<? super A, E> nonNullParent =
          throwIllegalArgumentIfNull(parent, "Parent event handlers");

      copyFrom(nonNullParent);
      return this;
    }

    /**
     * Replaces a handler obtained via {@link #inherit(EventHandlers)}.
     *
     * @param type of the event
     * @param handler replacing the inherited one
     * @param <T> the type of the event
     * @return this builder
     * @throws IllegalArgumentException if any of the arguments is {@code null}
     * @throws EventSourcingConfigurationException if there is no inherited handler to replace
     */
    public <T extends E> Builder<A, E> override(
        final Class<T> type, final BiConsumer<? super A, ? super T> handler) {
      final Class<T> nonNullType = verifyType(type);
      final BiConsumer<? super A, ? super T> nonNullHandler =
          throwIllegalArgumentIfNull(handler, "Event handler");

      if (!overridable.remove(nonNullType)) {
        throw new EventSourcingConfigurationException(
            "'%s' has no inherited handler for event '%s' to override"
                .formatted(aggregateClass.getSimpleName(), nonNullType.getName()));
      }

      handlers.put(nonNullType, adapt(nonNullType, nonNullHandler));
      return this;
    }

    /**
     * Declares the catch-all handler for events without a specific handler.
     *
     * <p>Without it, an event without a handler is a configuration error.
     *
     * @param handler receiving all otherwise unhandled events
     * @return this builder
     * @throws IllegalArgumentException if the handler is {@code null}
     * @throws EventSourcingConfigurationException if the catch-all handler was already declared
     */
    public Builder<A, E> otherwise(final BiConsumer<? super A, ? super E> handler) {
      final BiConsumer<? super A, ? super E> nonNullHandler =
          throwIllegalArgumentIfNull(handler, "Fallback event handler");

      if (fallbackDeclared) {
        throw new EventSourcingConfigurationException(
            "'%s' already declares a fallback event handler"
                .formatted(aggregateClass.getSimpleName()));
      }

      fallback = nonNullHandler::accept;
      fallbackDeclared = true;
      return this;
    }

    /**
     * @return a new immutable table
     * @throws EventSourcingConfigurationException if the event type is {@code sealed} and some of
     *     its concrete classes have no handler
     */
    public EventHandlers<A, E> build() {
      if (eventClass.isSealed() && fallback == null) {
        final Set<Class<? extends E>> unhandled =
            EventClasses.concreteSubclassesOf(eventClass).stream()
                .filter(type -> lookup(handlers, null, type).isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        if (!unhandled.isEmpty()) {
          throw new EventSourcingConfigurationException(
              "'%s' has no handlers for events: %s"
                  .formatted(
                      aggregateClass.getSimpleName(),
                      unhandled.stream().map(Class::getName).collect(Collectors.joining(", "))));
        }
      }

      LOGGER.debug(
          "Built event handlers of '{}' for {} event classes",
          aggregateClass.getSimpleName(),
          handlers.size());

      return new EventHandlers<>(this);
    }

    private <T extends E> Class<T> verifyType(final Class<T> type) {
      final Class<T> nonNullType = throwIllegalArgumentIfNull(type, "Event class");

      if (nonNullType.isInterface()) {
        throw new EventSourcingConfigurationException(
            "Handlers are resolved by class, '%s' cannot be an interface"
                .formatted(nonNullType.getName()));
      }

      return nonNullType;
    }

    private void copyFrom(final EventHandlers<? super A, E> parent) {
      for (var entry : parent.handlers.entrySet()) {
        if (handlers.containsKey(entry.getKey())) {
          throw new EventSourcingConfigurationException(
              "'%s' already declares a handler for event '%s'"
                  .formatted(aggregateClass.getSimpleName(), entry.getKey().getName()));
        }

        final BiConsumer<? super A, E> inherited = entry.getValue();
        handlers.put(entry.getKey(), inherited::accept);
        overridable.add(entry.getKey());
      }

      if (parent.fallback != null && !fallbackDeclared) {
        final BiConsumer<? super A, E> inheritedFallback = parent.fallback;
        fallback = inheritedFallback::accept;
      }
    }

    private static <A, E, T extends E> BiConsumer<A, E> adapt(
        final Class<T> type, final BiConsumer<? super A, ? super T> handler) {
      return (aggregate, event) -> handler.accept(aggregate, type.cast(event));
    }
  }
}
