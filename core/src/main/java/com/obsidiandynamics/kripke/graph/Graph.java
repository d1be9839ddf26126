package com.obsidiandynamics.kripke.graph;

import com.obsidiandynamics.kripke.util.*;

import java.util.*;

/**
 * An explicit, finite Kripke structure: a set of named states, a labelling of each state with atomic
 * propositions, a successor relation and a set of initial states.<p>
 *
 * State names are resolved to dense {@link StateId} handles once, upon insertion; all per-state data is
 * thereafter held in index-addressed lists. A graph is meant to be built up front and then queried; it
 * must not be mutated while a formula is being evaluated over it.
 */
public final class Graph {
  private final Map<String, StateId> ids = new HashMap<>();

  private final List<StateId> states = new ArrayList<>();

  private final List<String> names = new ArrayList<>();

  private final List<Set<String>> labels = new ArrayList<>();

  private final List<List<StateId>> successors = new ArrayList<>();

  private final List<List<StateId>> predecessors = new ArrayList<>();

  private final List<BitSet> successorBits = new ArrayList<>();

  private final BitSet initial = new BitSet();

  private int numTransitions;

  public StateId addState(String name, String... labels) {
    return addState(name, Arrays.asList(labels));
  }

  /**
   * Adds a state with the given name and labels. Adding a name that already exists returns the existing
   * handle, merging any new labels into those already held by the state.
   *
   * @param name The state name.
   * @param labels The atomic propositions that hold in this state.
   * @return The state's handle.
   */
  public StateId addState(String name, Collection<String> labels) {
    Assert.argument(name != null, () -> "State name cannot be null");
    final var existing = ids.get(name);
    if (existing != null) {
      this.labels.get(existing.getIndex()).addAll(labels);
      return existing;
    }

    final var id = new StateId(this, states.size());
    ids.put(name, id);
    states.add(id);
    names.add(name);
    this.labels.add(new TreeSet<>(labels));
    successors.add(new ArrayList<>());
    predecessors.add(new ArrayList<>());
    successorBits.add(new BitSet());
    return id;
  }

  /**
   * Adds a transition between two named states, creating either state (with no labels) if it does not
   * yet exist. Repeated edges are ignored.
   */
  public void addEdge(String from, String to) {
    addEdge(addState(from), addState(to));
  }

  public void addEdge(StateId from, StateId to) {
    checkState(from);
    checkState(to);
    final var bits = successorBits.get(from.getIndex());
    if (! bits.get(to.getIndex())) {
      bits.set(to.getIndex());
      successors.get(from.getIndex()).add(to);
      predecessors.get(to.getIndex()).add(from);
      numTransitions++;
    }
  }

  public void setInitial(String name) {
    setInitial(addState(name));
  }

  public void setInitial(StateId id) {
    checkState(id);
    initial.set(id.getIndex());
  }

  public int size() {
    return states.size();
  }

  public int numTransitions() {
    return numTransitions;
  }

  public boolean contains(StateId id) {
    return id != null && id.getGraph() == this && id.getIndex() >= 0 && id.getIndex() < states.size();
  }

  public List<StateId> states() {
    return Collections.unmodifiableList(states);
  }

  public List<StateId> succ(StateId id) {
    checkState(id);
    return Collections.unmodifiableList(successors.get(id.getIndex()));
  }

  public List<StateId> pred(StateId id) {
    checkState(id);
    return Collections.unmodifiableList(predecessors.get(id.getIndex()));
  }

  public boolean hasLabel(StateId id, String prop) {
    checkState(id);
    return labels.get(id.getIndex()).contains(prop);
  }

  public Set<String> labelsOf(StateId id) {
    checkState(id);
    return Collections.unmodifiableSet(labels.get(id.getIndex()));
  }

  public String nameOf(StateId id) {
    checkState(id);
    return names.get(id.getIndex());
  }

  public Optional<StateId> findState(String name) {
    return Optional.ofNullable(ids.get(name));
  }

  public StateId stateOf(String name) {
    final var id = ids.get(name);
    if (id == null) {
      throw new UnknownStateException("No such state " + name);
    }
    return id;
  }

  public StateSet initialStates() {
    return new StateSet(this, (BitSet) initial.clone());
  }

  public StateSet emptySet() {
    return new StateSet(this, new BitSet());
  }

  public StateSet allStates() {
    final var bits = new BitSet();
    bits.set(0, states.size());
    return new StateSet(this, bits);
  }

  public StateSet setOf(String... names) {
    final var set = emptySet();
    for (var name : names) {
      set.add(stateOf(name));
    }
    return set;
  }

  /**
   * The existential predecessor of {@code target}: all states with at least one successor in the
   * target set.
   */
  public StateSet preExists(StateSet target) {
    checkOwned(target);
    final var bits = new BitSet();
    final var targetBits = target.bits();
    for (var t = targetBits.nextSetBit(0); t >= 0; t = targetBits.nextSetBit(t + 1)) {
      for (var s : predecessors.get(t)) {
        bits.set(s.getIndex());
      }
    }
    return new StateSet(this, bits);
  }

  /**
   * The universal predecessor of {@code target}: all states whose successors all lie in the target set.
   * A state without successors qualifies vacuously.
   */
  public StateSet preAll(StateSet target) {
    checkOwned(target);
    final var bits = new BitSet();
    final var targetBits = target.bits();
    stateLoop: for (var s = 0; s < states.size(); s++) {
      for (var t : successors.get(s)) {
        if (! targetBits.get(t.getIndex())) {
          continue stateLoop;
        }
      }
      bits.set(s);
    }
    return new StateSet(this, bits);
  }

  void checkState(StateId id) {
    if (! contains(id)) {
      throw new UnknownStateException("No such state " + id + " in a graph of " + states.size() + " states");
    }
  }

  private void checkOwned(StateSet set) {
    Assert.argument(set.getGraph() == this, () -> "State set belongs to a different graph");
  }

  @Override
  public String toString() {
    return Graph.class.getSimpleName() + "[states=" + states.size() + ", transitions=" + numTransitions +
        ", initial=" + initialStates() + ']';
  }
}
