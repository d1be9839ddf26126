package com.obsidiandynamics.kripke.graph;

import java.util.*;

/**
 * An opaque handle to one state of a {@link Graph}. Handles are dense indices, allocated in the order
 * states are added, and remain stable for the lifetime of the graph. A handle is bound to the graph that
 * issued it; handles of different graphs are never equal, even when their indices coincide.
 */
public final class StateId implements Comparable<StateId> {
  private final Graph graph;

  private final int index;

  StateId(Graph graph, int index) {
    this.graph = graph;
    this.index = index;
  }

  Graph getGraph() {
    return graph;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public int compareTo(StateId o) {
    return Integer.compare(index, o.index);
  }

  @Override
  public int hashCode() {
    return Objects.hash(graph, index);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof StateId) {
      final var that = (StateId) o;
      return index == that.index && Objects.equals(graph, that.graph);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return StateId.class.getSimpleName() + '[' + index + ']';
  }
}
