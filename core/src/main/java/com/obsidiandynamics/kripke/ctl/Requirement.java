package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.graph.*;
import com.obsidiandynamics.kripke.util.*;

/**
 * A named, described CTL property of a model.
 */
public final class Requirement {
  private final String id;

  private final String description;

  private final Formula formula;

  private Requirement(String id, String description, Formula formula) {
    Assert.argument(id != null, () -> "Requirement ID cannot be null");
    Assert.argument(formula != null, () -> "Formula cannot be null");
    this.id = id;
    this.description = description;
    this.formula = formula;
  }

  public static Requirement of(String id, String description, Formula formula) {
    return new Requirement(id, description, formula);
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public Formula getFormula() {
    return formula;
  }

  public Verdict check(Graph graph) {
    return check(Evaluation.over(graph));
  }

  public Verdict check(Evaluation evaluation) {
    return new Verdict(this, evaluation.sat(formula));
  }

  @Override
  public String toString() {
    return Requirement.class.getSimpleName() + "[id=" + id + ", description=" + description + ", formula=" + formula + ']';
  }
}
