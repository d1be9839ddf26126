package com.obsidiandynamics.kripke.scenario;

import com.obsidiandynamics.kripke.actor.*;
import com.obsidiandynamics.kripke.ctl.*;
import com.obsidiandynamics.kripke.graph.*;

import java.util.*;

/**
 * A model that can be both simulated and checked. The simulation side is a {@link World} of actors whose
 * post-run state is validated by {@link #verify}; the checking side is a hand-built abstraction of the
 * same model as a {@link Graph}, together with the CTL requirements that the abstraction should satisfy.
 *
 * @param <S> The per-run state, holding the world and whatever bookkeeping the scenario needs to verify it.
 */
public interface Scenario<S> {
  String getName();

  S instantiate(long seed);

  World world(S state);

  /**
   * Checks the post-run invariants of the given state, failing with an {@link AssertionError} if any
   * are violated.
   */
  void verify(S state);

  Graph graph();

  List<Requirement> getRequirements();
}
