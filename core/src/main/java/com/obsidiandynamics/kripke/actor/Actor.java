package com.obsidiandynamics.kripke.actor;

import java.util.*;

/**
 * An actor with private local state, participating in a {@link World}. The only view others have of an
 * actor is its readiness: the steps it is willing to take right now.
 */
public interface Actor {
  String getId();

  /**
   * Offers the steps this actor is currently willing to execute. Every guard (local predicates as well as
   * {@link Channel#canSend()} and {@link Channel#canRecv()}) must be evaluated here, before a step is
   * offered: a returned step must be executable without any further check. Several steps may be offered
   * at once when several independent guards hold.
   *
   * @param world The world, for looking up channels.
   * @return The enabled steps; empty if and only if the actor has nothing to do.
   */
  List<Step> ready(World world);
}
