package io.github.diyes.ddd.es;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class DomainRuleViolationExceptionTest {
  @Test
  void all_exception_constructors_must_be_present() {
    assertDoesNotThrow(() -> new DomainRuleViolationException());
    assertDoesNotThrow(() -> new DomainRuleViolationException("message"));
    assertDoesNotThrow(
        () -> new DomainRuleViolationException("message", new IllegalStateException()));
    assertDoesNotThrow(() -> new DomainRuleViolationException(new IllegalStateException()));
  }

  @Test
  void broken_rule_and_revealing_cause_must_be_kept() {
    IllegalStateException cause = new IllegalStateException("copy B1 is borrowed");

    DomainRuleViolationException withBoth =
        new DomainRuleViolationException("Copy is not available", cause);
    assertEquals("Copy is not available", withBoth.getMessage());
    assertSame(cause, withBoth.getCause());

    DomainRuleViolationException withCause = new DomainRuleViolationException(cause);
    assertEquals(cause.toString(), withCause.getMessage());
    assertSame(cause, withCause.getCause());
  }

  @Test
  void must_have_unprocessable_content_http_status_code() {
    assertEquals(422, new DomainRuleViolationException().getStatusCode());
  }
}
