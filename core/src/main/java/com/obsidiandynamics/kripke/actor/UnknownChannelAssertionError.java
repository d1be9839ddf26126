package com.obsidiandynamics.kripke.actor;

/**
 * Raised when a model refers to a channel address that was never registered with the world. This is
 * a wiring error in the model, not a runtime condition to recover from.
 */
public final class UnknownChannelAssertionError extends AssertionError {
  private static final long serialVersionUID = 1L;

  public UnknownChannelAssertionError(String m) {
    super(m, null);
  }
}
