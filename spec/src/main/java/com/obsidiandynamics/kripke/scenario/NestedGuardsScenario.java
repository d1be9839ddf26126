package com.obsidiandynamics.kripke.scenario;

import com.obsidiandynamics.kripke.actor.*;
import com.obsidiandynamics.kripke.ctl.*;
import com.obsidiandynamics.kripke.graph.*;
import com.obsidiandynamics.kripke.scenario.NestedGuardsScenario.*;
import com.obsidiandynamics.kripke.util.*;

import java.util.*;

import static com.obsidiandynamics.kripke.ctl.Formula.*;

/**
 * A single counter whose guards overlap: away from the bounds it may both increment and decrement, and at
 * the upper bound it may both decrement and reset. The actor offers every enabled transition at once and
 * leaves the choice to the scheduler.
 */
public final class NestedGuardsScenario implements Scenario<State> {
  public static class Options {
    public int initial;
    public int upper;
    public int resetTo;

    void validate() {
      Assert.that(upper > 0);
      Assert.that(initial >= 0 && initial <= upper);
      Assert.that(resetTo >= 0 && resetTo < upper);
    }
  }

  private static final Options DEF_OPTIONS = new Options() {{
    initial = 5;
    upper = 20;
    resetTo = 10;
  }};

  enum Transition {
    DECREMENT,
    INCREMENT,
    RESET
  }

  static final class Counter implements Actor {
    private final Options options;

    private final Map<Transition, Integer> counts = new EnumMap<>(Transition.class);

    int value;

    Counter(Options options) {
      this.options = options;
      value = options.initial;
      for (var transition : Transition.values()) {
        counts.put(transition, 0);
      }
    }

    @Override
    public String getId() {
      return "counter";
    }

    int count(Transition transition) {
      return counts.get(transition);
    }

    private Step fire(Transition transition, int next) {
      return __ -> {
        value = next;
        counts.merge(transition, 1, Integer::sum);
      };
    }

    @Override
    public List<Step> ready(World world) {
      final var steps = new ArrayList<Step>(2);
      if (value > 0) {
        steps.add(fire(Transition.DECREMENT, value - 1));
      }
      if (value < options.upper) {
        steps.add(fire(Transition.INCREMENT, value + 1));
      }
      if (value == options.upper) {
        steps.add(fire(Transition.RESET, options.resetTo));
      }
      return steps;
    }
  }

  public static final class State {
    final Counter counter;
    final World world;

    State(Counter counter, World world) {
      this.counter = counter;
      this.world = world;
    }
  }

  private final Options options;

  public NestedGuardsScenario() {
    this(DEF_OPTIONS);
  }

  public NestedGuardsScenario(Options options) {
    options.validate();
    this.options = options;
  }

  @Override
  public String getName() {
    return "nested guards (0.." + options.upper + ")";
  }

  @Override
  public State instantiate(long seed) {
    final var counter = new Counter(options);
    return new State(counter, new World(List.of(counter), List.of(), seed));
  }

  @Override
  public World world(State state) {
    return state.world;
  }

  @Override
  public void verify(State state) {
    final var counter = state.counter;
    final var decrements = counter.count(Transition.DECREMENT);
    final var increments = counter.count(Transition.INCREMENT);
    final var resets = counter.count(Transition.RESET);
    Assert.that(counter.value >= 0 && counter.value <= options.upper, () -> "Counter out of range: " + counter.value);
    Assert.that(decrements + increments + resets == state.world.getTime(),
                () -> String.format("%d transitions in %d ticks", decrements + increments + resets, state.world.getTime()));
    final var expected = options.initial + increments - decrements - resets * (options.upper - options.resetTo);
    Assert.that(counter.value == expected, () -> String.format("Counter is %d, expected %d", counter.value, expected));
  }

  @Override
  public Graph graph() {
    final var graph = new Graph();
    for (var x = 0; x <= options.upper; x++) {
      final var labels = new ArrayList<String>();
      if (x > 0) labels.add("can_decrement");
      if (x < options.upper) labels.add("can_increment");
      if (x == options.upper) labels.add("can_reset");
      if (x == 0) labels.add("at_zero");
      graph.addState(stateName(x), labels);
    }
    for (var x = 0; x <= options.upper; x++) {
      if (x > 0) graph.addEdge(stateName(x), stateName(x - 1));
      if (x < options.upper) graph.addEdge(stateName(x), stateName(x + 1));
    }
    graph.addEdge(stateName(options.upper), stateName(options.resetTo));
    graph.setInitial(stateName(options.initial));
    return graph;
  }

  private static String stateName(int x) {
    return "x_" + x;
  }

  @Override
  public List<Requirement> getRequirements() {
    return List.of(
        Requirement.of("N1", "The counter never deadlocks", ag(ex(truth()))),
        Requirement.of("N2", "The upper bound is reachable", ef(atom("can_reset"))),
        Requirement.of("N3", "Zero is always reachable", ag(ef(atom("at_zero")))),
        Requirement.of("N4", "A reset always competes with a decrement", ag(implies(atom("can_reset"), atom("can_decrement")))),
        Requirement.of("N5", "Some state offers both increment and decrement", ef(and(atom("can_increment"), atom("can_decrement")))));
  }
}
