package com.obsidiandynamics.kripke.run;

import com.obsidiandynamics.kripke.scenario.*;

public class RunAllScenarios {
  public static void main(String[] args) {
    final var reports = AllScenarios.run(Harness.scaledOptions());
    final var failed = reports.stream().filter(report -> ! report.allHold() || ! report.isDeterministic()).count();
    System.out.format("%d of %d scenario(s) passed\n", reports.size() - failed, reports.size());
    if (failed != 0) {
      System.exit(1);
    }
  }
}
