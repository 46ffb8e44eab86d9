package io.github.diyes.ddd.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.diyes.ddd.es.EventSourcingConfigurationException;
import io.github.diyes.test.library.BookEvent;
import io.github.diyes.test.library.BookEvent.BookCreated;
import io.github.diyes.test.library.BookEvent.CopyBorrowed;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventTypeRegistryTest {
  @Nested
  class Registration {
    @Test
    void register_all_must_register_every_concrete_event_of_sealed_hierarchy() {
      final var registry = EventTypeRegistry.builder().registerAll(BookEvent.class).build();

      assertEquals(
          Set.of(
              "BookCreated",
              "BookTitleUpdated",
              "BookAuthorUpdated",
              "BookYearPublishedUpdated",
              "CopyAdded",
              "CopyRemoved",
              "CopyBorrowed",
              "CopyReturned"),
          registry.getEventTypes());
    }

    @Test
    void register_all_must_walk_nested_sealed_hierarchies() {
      final var registry = EventTypeRegistry.builder().registerAll(Shipment.class).build();

      assertEquals(Set.of("Packed", "Shipped", "Delivered"), registry.getEventTypes());
      assertFalse(registry.isRegistered(Transit.class));
    }

    @Test
    void registering_same_class_twice_must_be_tolerated() {
      final var registry =
          EventTypeRegistry.builder()
              .register(BookCreated.class)
              .register(BookCreated.class)
              .build();

      assertEquals(Set.of("BookCreated"), registry.getEventTypes());
    }

    @Test
    void when_two_classes_share_a_name_configuration_exception_is_thrown() {
      final var builder = EventTypeRegistry.builder().register(BookCreated.class);

      assertThrows(
          EventSourcingConfigurationException.class, () -> builder.register(Duplicate.class));
    }

    @Test
    void when_class_is_not_concrete_illegal_argument_exception_is_thrown() {
      final var builder = EventTypeRegistry.builder();

      assertThrows(IllegalArgumentException.class, () -> builder.register(BookEvent.class));
      assertThrows(IllegalArgumentException.class, () -> builder.register(null));
    }
  }

  @Nested
  class Lookup {
    final EventTypeRegistry registry =
        EventTypeRegistry.builder().registerAll(BookEvent.class).build();

    @Test
    void registered_type_must_be_found() {
      assertEquals(Optional.of(CopyBorrowed.class), registry.findEventClass("CopyBorrowed"));
      assertEquals(CopyBorrowed.class, registry.getEventClass("CopyBorrowed"));
      assertTrue(registry.isRegistered(CopyBorrowed.class));
    }

    @Test
    void unknown_type_must_not_be_found() {
      assertEquals(Optional.empty(), registry.findEventClass("CopyLost"));
      assertEquals(Optional.empty(), registry.findEventClass(null));
      assertThrows(IllegalArgumentException.class, () -> registry.getEventClass("CopyLost"));
      assertFalse(registry.isRegistered(Duplicate.class));
    }

    @Test
    void event_types_must_be_immutable() {
      final var eventTypes = registry.getEventTypes();

      assertThrows(UnsupportedOperationException.class, () -> eventTypes.remove("BookCreated"));
    }
  }

  @EventType("BookCreated")
  record Duplicate() implements Event {}

  sealed interface Shipment extends Event {}

  record Packed() implements Shipment {}

  sealed interface Transit extends Shipment {}

  record Shipped() implements Transit {}

  record Delivered() implements Transit {}
}
