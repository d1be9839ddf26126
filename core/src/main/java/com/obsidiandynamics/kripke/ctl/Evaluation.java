package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.ctl.Formula.*;
import com.obsidiandynamics.kripke.graph.*;
import com.obsidiandynamics.kripke.util.*;
import org.slf4j.*;

import java.util.function.*;

/**
 * Evaluates CTL formulas over a {@link Graph} using backward fixpoint iteration. Typical use:<p>
 *
 * <pre>{@code
 * final var satisfying = Evaluation.over(graph).sat(Formula.ag(Formula.ef(Formula.atom("idle"))));
 * }</pre>
 */
public final class Evaluation {
  private static final Logger log = LoggerFactory.getLogger(Evaluation.class);

  private final Graph graph;

  private FixpointObserver fixpointObserver = (__operator, __rounds, __numStates) -> {};

  private Evaluation(Graph graph) {
    this.graph = graph;
  }

  public static Evaluation over(Graph graph) {
    Assert.argument(graph != null, () -> "Graph cannot be null");
    return new Evaluation(graph);
  }

  public Evaluation withFixpointObserver(FixpointObserver fixpointObserver) {
    Assert.argument(fixpointObserver != null, () -> "Fixpoint observer cannot be null");
    this.fixpointObserver = fixpointObserver;
    return this;
  }

  Graph getGraph() {
    return graph;
  }

  public StateSet sat(Formula formula) {
    return formula.evaluate(this);
  }

  /**
   * Determines whether {@code formula} holds in every initial state of the graph.
   */
  public boolean holds(Formula formula) {
    return sat(formula).containsAll(graph.initialStates());
  }

  /**
   * Iterates {@code Y := Y ∪ step(Y)} from {@code seed} until the set stops growing.
   */
  StateSet leastFixpoint(Operator operator, StateSet seed, UnaryOperator<StateSet> step) {
    return iterate(operator, seed, y -> y.union(step.apply(y)));
  }

  /**
   * Iterates {@code Y := Y ∩ step(Y)} from {@code seed} until the set stops shrinking.
   */
  StateSet greatestFixpoint(Operator operator, StateSet seed, UnaryOperator<StateSet> step) {
    return iterate(operator, seed, y -> y.intersect(step.apply(y)));
  }

  private StateSet iterate(Operator operator, StateSet seed, UnaryOperator<StateSet> round) {
    final var numStates = graph.size();
    var current = seed;
    var rounds = 0;
    while (true) {
      final var next = round.apply(current);
      if (next.equals(current)) {
        break;
      }
      rounds++;
      final var _rounds = rounds;
      Assert.that(rounds <= numStates, () -> String.format("%s failed to converge after %d rounds over %d states", operator, _rounds, numStates));
      current = next;
    }

    log.trace("{} converged after {} round(s) over {} states, {} satisfying", operator, rounds, numStates, current.size());
    fixpointObserver.onConverged(operator, rounds, numStates);
    return current;
  }
}
