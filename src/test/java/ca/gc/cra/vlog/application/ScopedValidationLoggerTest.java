package ca.gc.cra.vlog.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.vlog.domain.LogMessage;
import ca.gc.cra.vlog.domain.ValidationLevel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScopedValidationLoggerTest {

  @Test
  void defaultLevelsDropTraceAndDebug() {
    ScopedValidationLogger logger = new ScopedValidationLogger();

    logger.log(ValidationLevel.TRACE, "Test", "trace");
    logger.log(ValidationLevel.DEBUG, "Test", "debug");

    assertEquals(ValidationLevel.DEFAULT, logger.enabledLevels());
    assertTrue(logger.logMessages().isEmpty());
    assertEquals(ValidationLevel.NONE, logger.loggedLevels());
  }

  @Test
  void emptyLoggerRendersNothingAndPasses() {
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.ALL);

    assertEquals("", logger.toString());
    assertEquals(0, logger.errors());
    assertEquals(0, logger.warnings());
    assertTrue(logger.passedValidation());
    assertFalse(logger.hasWarning());
  }

  @Test
  void countersIgnoreFiltering() {
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.TRACE);

    logger.log(ValidationLevel.ERROR, "a", "first");
    logger.log(ValidationLevel.ERROR, "b", "second");
    logger.log(ValidationLevel.WARNING, "c", "third");

    assertEquals(2, logger.errors());
    assertEquals(1, logger.warnings());
    assertTrue(logger.logMessages().isEmpty());
    assertTrue(logger.passedValidation(), "filtered errors do not fail validation");
    assertFalse(logger.hasWarning());
  }

  @Test
  void loggedLevelsIsUnionOfRecordedLevels() {
    ScopedValidationLogger logger = new ScopedValidationLogger(
        ValidationLevel.of(ValidationLevel.DEBUG, ValidationLevel.WARNING));

    logger.debug("p", "kept");
    logger.warning("p", "kept");
    logger.info("p", "dropped");
    logger.error("p", "dropped");

    assertEquals(ValidationLevel.of(ValidationLevel.DEBUG, ValidationLevel.WARNING), logger.loggedLevels());
    assertTrue(logger.hasFlag(ValidationLevel.DEBUG));
    assertFalse(logger.hasFlag(ValidationLevel.INFORMATION));
    assertTrue(logger.hasWarning());
    assertTrue(logger.passedValidation());
  }

  @Test
  void recordedErrorFailsValidation() {
    ScopedValidationLogger logger = new ScopedValidationLogger();

    logger.error("field", "bad");

    assertFalse(logger.passedValidation());
    assertTrue(logger.hasFlag(ValidationLevel.ERROR));
  }

  @Test
  void invalidLevelsAreRejectedWithoutSideEffects() {
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.ALL);
    logger.warning("p", "one");

    for (ValidationLevel invalid : List.of(
        ValidationLevel.NONE,
        ValidationLevel.ALL,
        ValidationLevel.WARNING.or(ValidationLevel.ERROR),
        new ValidationLevel(64))) {
      assertThrows(IllegalArgumentException.class, () -> logger.log(invalid, "p", "m"), invalid.toString());
    }
    assertThrows(IllegalArgumentException.class, () -> logger.log(null, "p", "m"));

    assertEquals(1, logger.warnings());
    assertEquals(0, logger.errors());
    assertEquals(1, logger.logMessages().size());
    assertEquals(ValidationLevel.WARNING, logger.loggedLevels());
  }

  @Test
  void enabledLevelsChangeOnlyAffectsLaterMessages() {
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.ALL);
    logger.trace("p", "before");

    logger.setEnabledLevels(ValidationLevel.ERROR);
    logger.trace("p", "after");

    assertEquals(1, logger.logMessages().size());
    assertEquals("before", logger.logMessages().get(0).message());
    assertTrue(logger.isEnabled(ValidationLevel.ERROR));
    assertFalse(logger.isEnabled(ValidationLevel.TRACE));
    assertTrue(logger.isEnabled(ValidationLevel.ALL));
    assertThrows(NullPointerException.class, () -> logger.setEnabledLevels(null));
  }

  @Test
  void messagesSnapshotTheScopeStack() {
    ScopedValidationLogger logger = new ScopedValidationLogger();

    try (ValidationScope outer = logger.beginScope("outer")) {
      logger.info("a", "in outer");
      try (ValidationScope inner = logger.beginScope("inner")) {
        logger.info("b", "in inner");
      }
    }
    logger.info("c", "at root");

    List<LogMessage> messages = logger.logMessages();
    assertEquals(List.of("outer"), messages.get(0).scope());
    assertEquals(List.of("outer", "inner"), messages.get(1).scope());
    assertEquals(List.of(), messages.get(2).scope());
  }

  @Test
  void logMessagesViewIsReadOnly() {
    ScopedValidationLogger logger = new ScopedValidationLogger();
    logger.info("p", "m");

    assertThrows(UnsupportedOperationException.class, () -> logger.logMessages().clear());
  }

  @Test
  void closingScopeTwiceIsNoOp() {
    ScopedValidationLogger logger = new ScopedValidationLogger();
    ValidationScope first = logger.beginScope("first");
    ValidationScope second = logger.beginScope("second");

    second.close();
    second.close();

    assertEquals(1, logger.scopeDepth());
    assertTrue(second.isClosed());
    assertFalse(first.isClosed());
  }

  @Test
  void closingOuterScopeClosesNestedScopes() {
    ScopedValidationLogger logger = new ScopedValidationLogger();
    ValidationScope outer = logger.beginScope("outer");
    ValidationScope inner = logger.beginScope("inner");
    logger.beginScope("innermost");

    outer.close();
    assertEquals(0, logger.scopeDepth());

    inner.close();
    assertEquals(0, logger.scopeDepth());

    logger.beginScope("fresh");
    inner.close();
    assertEquals(1, logger.scopeDepth(), "a closed handle must not pop later scopes");
  }

  @Test
  void scopeClosesWhenBlockExitsWithException() {
    ScopedValidationLogger logger = new ScopedValidationLogger();

    assertThrows(IllegalStateException.class, () -> {
      try (ValidationScope scope = logger.beginScope("failing")) {
        throw new IllegalStateException("boom");
      }
    });

    assertEquals(0, logger.scopeDepth());
  }

  @Test
  void duplicateAndEmptyScopeNamesAreAllowed() {
    ScopedValidationLogger logger = new ScopedValidationLogger();

    try (ValidationScope a = logger.beginScope("same");
        ValidationScope b = logger.beginScope("same");
        ValidationScope c = logger.beginScope("")) {
      assertEquals(3, c.depth());
      logger.info("p", "m");
    }

    assertEquals(List.of("same", "same", ""), logger.logMessages().get(0).scope());
  }

  @Test
  void demoScenarioProducesNestedReport() {
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.ALL);

    logger.log(ValidationLevel.TRACE, "Test", "Starting log.");
    logger.log(ValidationLevel.DEBUG, "Test", "Debug message");
    try (ValidationScope scope1 = logger.beginScope("Scope1")) {
      logger.log(ValidationLevel.INFORMATION, "InScope", "At the information level.");
      logger.log(ValidationLevel.WARNING, "Something", "Danger, Will Robinson!");
      try (ValidationScope scope2 = logger.beginScope("Scope2")) {
        logger.log(ValidationLevel.ERROR, "CPU", "CPU Failure imminent.");
      }
      logger.log(ValidationLevel.TRACE, "Test", "Scope2 Ended");
    }
    logger.log(ValidationLevel.TRACE, "Test", "Scope1 Ended");
    try (ValidationScope some = logger.beginScope("SomeScope")) {
      logger.log(ValidationLevel.ERROR, "Outer", "You have reached the outer limits");
    }
    logger.log(ValidationLevel.TRACE, "Test", "Ending log.");

    assertEquals(2, logger.errors());
    assertEquals(1, logger.warnings());
    assertFalse(logger.passedValidation());
    assertTrue(logger.hasWarning());
    assertEquals(ValidationLevel.ALL, logger.loggedLevels());
    assertEquals(String.join("\n",
        "Trace: Test: Starting log.",
        "Debug: Test: Debug message",
        "Scope1 {",
        "  Information: InScope: At the information level.",
        "  Warning: Something: Danger, Will Robinson!",
        "  Scope2 {",
        "    Error: CPU: CPU Failure imminent.",
        "  }",
        "  Trace: Test: Scope2 Ended",
        "}",
        "Trace: Test: Scope1 Ended",
        "SomeScope {",
        "  Error: Outer: You have reached the outer limits",
        "}",
        "Trace: Test: Ending log.",
        ""), logger.toString());
  }

  @Test
  void metricsCountScopesAndMessages() {
    List<String> keys = new ArrayList<>();
    ScopedValidationLogger logger = new ScopedValidationLogger(ValidationLevel.DEFAULT, keys::add);

    try (ValidationScope scope = logger.beginScope("s")) {
      logger.warning("p", "recorded");
      logger.trace("p", "filtered");
    }
    assertThrows(IllegalArgumentException.class, () -> logger.log(ValidationLevel.NONE, "p", "m"));

    assertEquals(List.of(
        "validation.scope.opened",
        "validation.message.recorded",
        "validation.message.warning",
        "validation.message.filtered",
        "validation.message.rejected"), keys);
  }

  @Test
  void constructorRejectsNullArguments() {
    assertThrows(NullPointerException.class, () -> new ScopedValidationLogger(null));
    assertThrows(NullPointerException.class,
        () -> new ScopedValidationLogger(ValidationLevel.ALL, null));
  }

  @Test
  void loggerIsUsableThroughInterface() {
    ScopedValidationLogger concrete = new ScopedValidationLogger();
    ValidationLogger logger = concrete;

    logger.error("p", "m");

    assertSame(ValidationLevel.ERROR, concrete.logMessages().get(0).level());
  }
}
