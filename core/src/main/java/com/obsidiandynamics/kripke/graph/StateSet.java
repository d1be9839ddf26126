package com.obsidiandynamics.kripke.graph;

import com.obsidiandynamics.kripke.util.*;

import java.util.*;
import java.util.stream.*;

/**
 * A set of states drawn from a single {@link Graph}, held as a bitset over the graph's dense state
 * indices. Only {@link #add} mutates a set; the set-algebraic operations return new instances.
 */
public final class StateSet implements Iterable<StateId> {
  private final Graph graph;

  private final BitSet bits;

  StateSet(Graph graph, BitSet bits) {
    this.graph = graph;
    this.bits = bits;
  }

  public Graph getGraph() {
    return graph;
  }

  BitSet bits() {
    return bits;
  }

  public boolean add(StateId id) {
    graph.checkState(id);
    if (bits.get(id.getIndex())) {
      return false;
    } else {
      bits.set(id.getIndex());
      return true;
    }
  }

  public boolean contains(StateId id) {
    return graph.contains(id) && bits.get(id.getIndex());
  }

  public boolean containsAll(StateSet other) {
    checkSameGraph(other);
    final var missing = (BitSet) other.bits.clone();
    missing.andNot(bits);
    return missing.isEmpty();
  }

  public int size() {
    return bits.cardinality();
  }

  public boolean isEmpty() {
    return bits.isEmpty();
  }

  public StateSet copy() {
    return new StateSet(graph, (BitSet) bits.clone());
  }

  public StateSet union(StateSet other) {
    checkSameGraph(other);
    final var result = (BitSet) bits.clone();
    result.or(other.bits);
    return new StateSet(graph, result);
  }

  public StateSet intersect(StateSet other) {
    checkSameGraph(other);
    final var result = (BitSet) bits.clone();
    result.and(other.bits);
    return new StateSet(graph, result);
  }

  public StateSet minus(StateSet other) {
    checkSameGraph(other);
    final var result = (BitSet) bits.clone();
    result.andNot(other.bits);
    return new StateSet(graph, result);
  }

  /**
   * Complements this set with respect to all states of the graph.
   */
  public StateSet complement() {
    final var result = (BitSet) bits.clone();
    result.flip(0, graph.size());
    return new StateSet(graph, result);
  }

  @Override
  public Iterator<StateId> iterator() {
    return stream().iterator();
  }

  public Stream<StateId> stream() {
    final var states = graph.states();
    return bits.stream().mapToObj(states::get);
  }

  public List<String> names() {
    return stream().map(graph::nameOf).collect(Collectors.toList());
  }

  private void checkSameGraph(StateSet other) {
    Assert.argument(other.graph == graph, () -> "Cannot combine state sets of different graphs");
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof StateSet) {
      final var that = (StateSet) o;
      return graph == that.graph && bits.equals(that.bits);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return StateSet.class.getSimpleName() + names();
  }
}
