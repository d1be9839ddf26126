package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.graph.*;

/**
 * The outcome of checking a {@link Requirement} against a graph. A requirement holds when every initial
 * state satisfies it; its coverage additionally grades the satisfying set against all states.
 */
public final class Verdict {
  public enum Coverage {
    PASS,
    PARTIAL,
    FAIL
  }

  private final Requirement requirement;

  private final StateSet satisfying;

  private final boolean holds;

  private final Coverage coverage;

  Verdict(Requirement requirement, StateSet satisfying) {
    this.requirement = requirement;
    this.satisfying = satisfying;
    final var graph = satisfying.getGraph();
    holds = satisfying.containsAll(graph.initialStates());
    if (satisfying.size() == graph.size()) {
      coverage = Coverage.PASS;
    } else if (satisfying.isEmpty()) {
      coverage = Coverage.FAIL;
    } else {
      coverage = Coverage.PARTIAL;
    }
  }

  public Requirement getRequirement() {
    return requirement;
  }

  public StateSet getSatisfying() {
    return satisfying;
  }

  public boolean holds() {
    return holds;
  }

  public Coverage getCoverage() {
    return coverage;
  }

  @Override
  public String toString() {
    return Verdict.class.getSimpleName() + "[requirement=" + requirement.getId() + ", holds=" + holds +
        ", coverage=" + coverage + ", satisfying=" + satisfying.size() + '/' + satisfying.getGraph().size() + ']';
  }
}
