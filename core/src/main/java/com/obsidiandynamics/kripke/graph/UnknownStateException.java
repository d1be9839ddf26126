package com.obsidiandynamics.kripke.graph;

public final class UnknownStateException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public UnknownStateException(String m) {
    super(m);
  }
}
