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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.vavr.control.Try;
import java.util.Map;

/**
 * Converts {@link Event}s to primitive representations and back, for collaborators which store
 * events.
 *
 * <p>The payload never contains the type name - it is expected to be stored separately, next to the
 * payload, and resolved via {@link EventTypeRegistry} when the event is rebuilt.
 *
 * <p>Rebuilding is lenient on purpose of replay: unknown payload keys are ignored and missing keys
 * fall back to Java defaults, so that events stored by a different version of the event class can
 * still be replayed.
 *
 * <p>Conversion failures are treated as system errors and reported as {@link
 * IllegalStateException}s.
 */
public final class EventMapper {
  private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

  private final EventTypeRegistry eventTypeRegistry;
  private final ObjectMapper objectMapper;

  /**
   * Creates a mapper with the default {@link ObjectMapper} configuration: {@link JavaTimeModule}
   * registered and dates written as ISO-8601 strings.
   *
   * @param eventTypeRegistry to resolve event classes with
   */
  public EventMapper(final EventTypeRegistry eventTypeRegistry) {
    this(eventTypeRegistry, defaultObjectMapper());
  }

  /**
   * Creates a mapper with a custom {@link ObjectMapper}.
   *
   * <p>Given mapper is copied and adjusted to tolerate unknown keys and events without components,
   * the original instance is left untouched.
   *
   * @param eventTypeRegistry to resolve event classes with
   * @param objectMapper to base the conversion on
   */
  public EventMapper(final EventTypeRegistry eventTypeRegistry, final ObjectMapper objectMapper) {
    if (eventTypeRegistry == null) {
      throw new IllegalArgumentException("Event type registry cannot be null");
    }

    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.eventTypeRegistry = eventTypeRegistry;
    this.objectMapper =
        objectMapper
            .copy()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
  }

  /**
   * @return the registry used to resolve event classes
   */
  public EventTypeRegistry getEventTypeRegistry() {
    return eventTypeRegistry;
  }

  /**
   * @param event to convert
   * @return event payload as a map of primitive values, lists and maps
   * @throws IllegalArgumentException if the event is {@code null}
   * @throws IllegalStateException if the event cannot be converted
   */
  public Map<String, Object> toMap(final Event event) {
    final Event nonNullEvent = requireEvent(event);
    return Try.of(() -> objectMapper.convertValue(nonNullEvent, PAYLOAD_TYPE))
        .getOrElseThrow(cause -> conversionFailure("convert", nonNullEvent.eventType(), cause));
  }

  /**
   * @param eventType stored next to the payload
   * @param payload produced by {@link #toMap(Event)}, possibly by another version of the class
   * @return rebuilt event
   * @throws IllegalArgumentException if the type is not registered or the payload is {@code null}
   * @throws IllegalStateException if the payload cannot be converted
   */
  public Event fromMap(final String eventType, final Map<String, ?> payload) {
    final Class<? extends Event> eventClass = eventTypeRegistry.getEventClass(eventType);

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    return Try.<Event>of(() -> objectMapper.convertValue(payload, eventClass))
        .getOrElseThrow(cause -> conversionFailure("rebuild", eventType, cause));
  }

  /**
   * @param event to convert
   * @return event payload as a JSON object
   * @throws IllegalArgumentException if the event is {@code null}
   * @throws IllegalStateException if the event cannot be converted
   */
  public String toJson(final Event event) {
    final Event nonNullEvent = requireEvent(event);
    return Try.of(() -> objectMapper.writeValueAsString(nonNullEvent))
        .getOrElseThrow(cause -> conversionFailure("serialize", nonNullEvent.eventType(), cause));
  }

  /**
   * @param eventType stored next to the payload
   * @param json produced by {@link #toJson(Event)}, possibly by another version of the class
   * @return rebuilt event
   * @throws IllegalArgumentException if the type is not registered or the JSON is {@code null}
   * @throws IllegalStateException if the JSON cannot be parsed
   */
  public Event fromJson(final String eventType, final String json) {
    final Class<? extends Event> eventClass = eventTypeRegistry.getEventClass(eventType);

    if (json == null) {
      throw new IllegalArgumentException("JSON cannot be null");
    }

    return Try.<Event>of(() -> objectMapper.readValue(json, eventClass))
        .getOrElseThrow(cause -> conversionFailure("deserialize", eventType, cause));
  }

  private static ObjectMapper defaultObjectMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }

  private static Event requireEvent(final Event event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    return event;
  }

  private static IllegalStateException conversionFailure(
      final String action, final String eventType, final Throwable cause) {
    return new IllegalStateException(
        "Failed to %s event of type '%s'".formatted(action, eventType), cause);
  }
}
