package com.obsidiandynamics.kripke.actor;

/**
 * One atomic transition, executed to completion by the {@link World} without interleaving.
 */
@FunctionalInterface
public interface Step {
  void execute(World world);
}
