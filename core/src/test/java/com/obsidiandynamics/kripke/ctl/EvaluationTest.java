package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.ctl.Formula.*;
import com.obsidiandynamics.kripke.graph.*;
import org.junit.jupiter.api.*;
import org.mockito.*;

import static com.obsidiandynamics.kripke.ctl.Formula.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class EvaluationTest {
  private static Graph chain(int length) {
    final var graph = new Graph();
    for (var i = 0; i < length - 1; i++) {
      graph.addEdge("s" + i, "s" + (i + 1));
    }
    graph.addState("s" + (length - 1), "goal");
    graph.setInitial("s0");
    return graph;
  }

  @Test
  void testOver_nullGraph() {
    assertThat(catchThrowable(() -> Evaluation.over(null))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testWithFixpointObserver_null() {
    final var evaluation = Evaluation.over(new Graph());
    assertThat(catchThrowable(() -> evaluation.withFixpointObserver(null)))
        .isInstanceOf(IllegalArgumentException.class).hasMessage("Fixpoint observer cannot be null");
  }

  @Test
  void testLeastFixpoint_roundsBoundedByStateCount() {
    final var graph = chain(6);
    final var observer = Mockito.mock(FixpointObserver.class);
    final var sat = Evaluation.over(graph).withFixpointObserver(observer).sat(ef(atom("goal")));

    assertThat(sat).isEqualTo(graph.allStates());
    final var rounds = ArgumentCaptor.forClass(Integer.class);
    verify(observer, times(1)).onConverged(eq(Operator.EF), rounds.capture(), eq(6));
    assertThat(rounds.getValue()).isEqualTo(5).isLessThanOrEqualTo(graph.size());
  }

  @Test
  void testGreatestFixpoint_observed() {
    final var graph = chain(4);
    final var observer = Mockito.mock(FixpointObserver.class);
    final var sat = Evaluation.over(graph).withFixpointObserver(observer).sat(eg(truth()));

    assertThat(sat.isEmpty()).isTrue();
    verify(observer, times(1)).onConverged(eq(Operator.EG), intThat(rounds -> rounds <= 4), eq(4));
  }

  @Test
  void testObserverNotifiedPerFixpoint() {
    final var graph = chain(3);
    final var observer = Mockito.mock(FixpointObserver.class);
    Evaluation.over(graph).withFixpointObserver(observer).sat(and(ag(ef(atom("goal"))), ex(atom("goal"))));

    verify(observer).onConverged(eq(Operator.EF), anyInt(), eq(3));
    verify(observer).onConverged(eq(Operator.AG), anyInt(), eq(3));
    verifyNoMoreInteractions(observer);
  }

  @Test
  void testHolds() {
    final var graph = chain(3);
    final var evaluation = Evaluation.over(graph);
    assertThat(evaluation.holds(ef(atom("goal")))).isTrue();
    assertThat(evaluation.holds(atom("goal"))).isFalse();
  }

  @Test
  void testHolds_vacuousWithoutInitialStates() {
    final var graph = new Graph();
    graph.addEdge("a", "b");
    assertThat(Evaluation.over(graph).holds(falsity())).isTrue();
  }

  @Test
  void testSat_emptyGraph() {
    final var graph = new Graph();
    assertThat(Evaluation.over(graph).sat(ag(ef(truth()))).isEmpty()).isTrue();
  }
}
