package io.github.diyes.test;

import io.github.diyes.ddd.es.AggregateRoot;
import io.github.diyes.ddd.es.DomainRuleViolationException;
import io.github.diyes.ddd.es.EventHandlers;
import io.github.diyes.test.CounterEvent.Exploded;
import io.github.diyes.test.CounterEvent.Locked;
import io.github.diyes.test.CounterEvent.Unlocked;
import io.github.diyes.test.CounterEvent.ValueAdded;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/** Aggregate exercising every kernel entry point. */
public class Counter extends AggregateRoot<UUID, CounterEvent, Counter> {
  static final EventHandlers<Counter, CounterEvent> HANDLERS =
      EventHandlers.builder(Counter.class, CounterEvent.class)
          .on(ValueAdded.class, Counter::onValueAdded)
          .on(Locked.class, (counter, event) -> counter.locked = true)
          .on(Unlocked.class, (counter, event) -> counter.locked = false)
          .on(
              Exploded.class,
              (counter, event) -> {
                throw new IllegalArgumentException(event.reason());
              })
          .build();

  private int value;
  private boolean locked;

  public Counter(UUID id) {
    super(id);
  }

  @Override
  protected EventHandlers<Counter, CounterEvent> eventHandlers() {
    return HANDLERS;
  }

  public ValueAdded add(int value) {
    return command(
        () -> {
          if (locked) {
            throw new DomainRuleViolationException("Counter is locked");
          }

          return new ValueAdded(value);
        });
  }

  public List<CounterEvent> addAll(int... values) {
    return commandAll(
        () -> {
          if (locked) {
            throw new DomainRuleViolationException("Counter is locked");
          }

          return Arrays.stream(values)
              .<CounterEvent>mapToObj(ValueAdded::new)
              .toList();
        });
  }

  public CounterEvent toggleLock() {
    return this.<CounterEvent>command(() -> locked ? new Unlocked() : new Locked());
  }

  public ValueAdded returnNothing() {
    return command(() -> null);
  }

  public void explode(String reason) {
    command(() -> new Exploded(reason));
  }

  public void produceDirectly(CounterEvent... events) {
    produceEvents(events);
  }

  public void produceDirectly(List<CounterEvent> events) {
    produceEvents(events);
  }

  public int value() {
    return value;
  }

  public boolean isLocked() {
    return locked;
  }

  private void onValueAdded(ValueAdded event) {
    this.value += event.value();
  }
}
