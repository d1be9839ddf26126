package com.obsidiandynamics.kripke.util;

import java.util.function.*;

/**
 * Fail-fast checks. Broken caller contracts surface as an {@link AssertionError} (or a subtype thereof),
 * whereas bad configuration surfaces as an {@link IllegalArgumentException} (or a subtype thereof).
 */
public final class Assert {
  private Assert() {}

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static void that(boolean condition) {
    that(condition, () -> "");
  }

  public static void that(boolean condition, Supplier<String> messageBuilder) {
    that(condition, AssertionError::new, messageBuilder);
  }

  public static void that(boolean condition, Function<String, ? extends AssertionError> errorMaker, Supplier<String> messageBuilder) {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }

  public static void isNotNull(Object obj, Supplier<String> messageBuilder) {
    that(obj != null, messageBuilder);
  }

  public static void argument(boolean condition, Supplier<String> messageBuilder) {
    argument(condition, IllegalArgumentException::new, messageBuilder);
  }

  public static void argument(boolean condition, Function<String, ? extends IllegalArgumentException> exceptionMaker, Supplier<String> messageBuilder) {
    if (! condition) {
      throw exceptionMaker.apply(messageBuilder.get());
    }
  }
}
