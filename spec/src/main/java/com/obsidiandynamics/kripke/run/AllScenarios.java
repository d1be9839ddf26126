package com.obsidiandynamics.kripke.run;

import com.obsidiandynamics.kripke.scenario.*;

import java.util.*;

final class AllScenarios {
  static List<Scenario<?>> list() {
    return List.of(new BoundedBufferScenario(), new NestedGuardsScenario(), new ClientServerScenario());
  }

  static List<Harness.Report> run(Harness.Options options) {
    final var reports = new ArrayList<Harness.Report>();
    for (var scenario : list()) {
      reports.add(Harness.run(scenario, options));
      System.out.println("-".repeat(50));
    }
    return reports;
  }
}
