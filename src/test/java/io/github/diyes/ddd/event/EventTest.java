package io.github.diyes.ddd.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.diyes.test.library.BookEvent.BookCreated;
import io.github.diyes.test.library.BookEvent.CopyReturned;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventTest {
  @Test
  void event_type_must_default_to_simple_class_name() {
    assertEquals("BookCreated", new BookCreated().eventType());
    assertEquals("BookCreated", Event.typeNameOf(BookCreated.class));
  }

  @Test
  void event_type_must_be_taken_from_annotation_when_present() {
    assertEquals("renamed-v2", new Renamed().eventType());
    assertEquals("renamed-v2", Event.typeNameOf(Renamed.class));
  }

  @Test
  void when_annotation_is_blank_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> Event.typeNameOf(Blank.class));
  }

  @Test
  void when_class_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> Event.typeNameOf(null));
  }

  @Test
  void domain_events_must_remain_events() {
    final Event returned = new CopyReturned("B1", Instant.now());
    final Event created = new BookCreated();

    assertInstanceOf(DomainEvent.class, returned);
    assertFalse(created instanceof DomainEvent);
  }

  @Test
  void events_with_same_components_must_be_equal() {
    final var now = Instant.now();

    assertEquals(new CopyReturned("B1", now), new CopyReturned("B1", now));
  }

  @EventType("renamed-v2")
  record Renamed() implements Event {}

  @EventType(" ")
  record Blank() implements Event {}
}
