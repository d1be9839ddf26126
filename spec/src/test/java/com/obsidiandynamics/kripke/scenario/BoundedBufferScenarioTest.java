package com.obsidiandynamics.kripke.scenario;

import com.obsidiandynamics.kripke.ctl.*;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

final class BoundedBufferScenarioTest {
  @Test
  void testRunToQuiescenceAndVerify() {
    final var scenario = new BoundedBufferScenario(new BoundedBufferScenario.Options() {{
      capacity = 1;
      numItems = 3;
    }});
    final var state = scenario.instantiate(1);
    final var steps = scenario.world(state).runSteps(100);

    assertThat(steps).isEqualTo(6);
    assertThat(state.producer.sent).isEqualTo(3);
    assertThat(state.consumer.received).isEqualTo(3);
    assertThat(state.world.events()).hasSize(3);
    scenario.verify(state);
  }

  @Test
  void testVerify_incompleteRun() {
    final var scenario = new BoundedBufferScenario();
    final var state = scenario.instantiate(1);
    scenario.world(state).runSteps(3);
    assertThat(catchThrowable(() -> scenario.verify(state))).isInstanceOf(AssertionError.class);
  }

  @Test
  void testRequirementsHold() {
    final var scenario = new BoundedBufferScenario();
    final var graph = scenario.graph();
    assertThat(graph.size()).isEqualTo(3);
    assertThat(graph.initialStates().names()).containsExactly("buffer_0");
    for (var requirement : scenario.getRequirements()) {
      assertThat(requirement.check(graph).holds()).as(requirement.toString()).isTrue();
    }
  }

  @Test
  void testFullOnlyReachableByProducing() {
    final var graph = new BoundedBufferScenario().graph();
    assertThat(Formula.ex(Formula.atom("buffer_full")).sat(graph).names()).containsExactly("buffer_1");
  }

  @Test
  void testInvalidOptions() {
    assertThat(catchThrowable(() -> new BoundedBufferScenario(new BoundedBufferScenario.Options() {{
      capacity = 0;
      numItems = 3;
    }}))).isInstanceOf(AssertionError.class);
  }
}
