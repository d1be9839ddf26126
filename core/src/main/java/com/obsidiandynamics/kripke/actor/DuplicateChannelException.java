package com.obsidiandynamics.kripke.actor;

public final class DuplicateChannelException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public DuplicateChannelException(String m) {
    super(m);
  }
}
