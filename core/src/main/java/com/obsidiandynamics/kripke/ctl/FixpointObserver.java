package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.ctl.Formula.*;

@FunctionalInterface
public interface FixpointObserver {
  /**
   * Invoked once a fixpoint iteration has stabilised.
   *
   * @param operator The temporal operator being evaluated.
   * @param rounds The number of rounds that changed the candidate set.
   * @param numStates The number of states in the graph, which bounds {@code rounds}.
   */
  void onConverged(Operator operator, int rounds, int numStates);
}
