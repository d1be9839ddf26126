package com.obsidiandynamics.kripke.ctl;

import com.obsidiandynamics.kripke.graph.*;
import com.obsidiandynamics.kripke.util.*;

import java.util.*;

/**
 * A CTL formula. The type is closed: every variant is nested within this class and the constructor is
 * private, so the set of operators is fixed at {@link Operator} and each is handled exhaustively by the
 * evaluator.<p>
 *
 * Formulas are immutable and compare structurally.
 */
public abstract class Formula {
  public enum Operator {
    TRUE, FALSE, ATOM, NOT, AND, OR, EX, AX, EF, AF, EG, AG, EU, AU
  }

  private Formula() {}

  public abstract Operator getOperator();

  abstract StateSet evaluate(Evaluation evaluation);

  /**
   * Computes the set of states of {@code graph} that satisfy this formula.
   */
  public final StateSet sat(Graph graph) {
    return Evaluation.over(graph).sat(this);
  }

  private static final Formula TRUE = new Constant(Operator.TRUE);

  private static final Formula FALSE = new Constant(Operator.FALSE);

  public static Formula truth() {
    return TRUE;
  }

  public static Formula falsity() {
    return FALSE;
  }

  public static Formula atom(String name) {
    return new Atom(name);
  }

  public static Formula not(Formula operand) {
    return new Unary(Operator.NOT, operand);
  }

  public static Formula and(Formula left, Formula right) {
    return new Binary(Operator.AND, left, right);
  }

  public static Formula or(Formula left, Formula right) {
    return new Binary(Operator.OR, left, right);
  }

  public static Formula implies(Formula antecedent, Formula consequent) {
    return or(not(antecedent), consequent);
  }

  public static Formula ex(Formula operand) {
    return new Unary(Operator.EX, operand);
  }

  public static Formula ax(Formula operand) {
    return new Unary(Operator.AX, operand);
  }

  public static Formula ef(Formula operand) {
    return new Unary(Operator.EF, operand);
  }

  public static Formula af(Formula operand) {
    return new Unary(Operator.AF, operand);
  }

  public static Formula eg(Formula operand) {
    return new Unary(Operator.EG, operand);
  }

  public static Formula ag(Formula operand) {
    return new Unary(Operator.AG, operand);
  }

  /**
   * {@code E[hold U until]}: on some path, {@code hold} holds in every state until a state satisfying
   * {@code until} is reached.
   */
  public static Formula eu(Formula hold, Formula until) {
    return new Binary(Operator.EU, hold, until);
  }

  /**
   * {@code A[hold U until]}: on every path, {@code hold} holds in every state until a state satisfying
   * {@code until} is reached.
   */
  public static Formula au(Formula hold, Formula until) {
    return new Binary(Operator.AU, hold, until);
  }

  public static final class Constant extends Formula {
    private final Operator operator;

    private Constant(Operator operator) {
      this.operator = operator;
    }

    @Override
    public Operator getOperator() {
      return operator;
    }

    @Override
    StateSet evaluate(Evaluation evaluation) {
      final var graph = evaluation.getGraph();
      return operator == Operator.TRUE ? graph.allStates() : graph.emptySet();
    }

    @Override
    public String toString() {
      return operator == Operator.TRUE ? "true" : "false";
    }
  }

  public static final class Atom extends Formula {
    private final String name;

    private Atom(String name) {
      Assert.argument(name != null, () -> "Atom name cannot be null");
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public Operator getOperator() {
      return Operator.ATOM;
    }

    @Override
    StateSet evaluate(Evaluation evaluation) {
      final var graph = evaluation.getGraph();
      final var result = graph.emptySet();
      for (var state : graph.states()) {
        if (graph.hasLabel(state, name)) {
          result.add(state);
        }
      }
      return result;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      } else if (o instanceof Atom) {
        return name.equals(((Atom) o).name);
      } else {
        return false;
      }
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class Unary extends Formula {
    private final Operator operator;

    private final Formula operand;

    private Unary(Operator operator, Formula operand) {
      Assert.argument(operand != null, () -> "Operand of " + operator + " cannot be null");
      this.operator = operator;
      this.operand = operand;
    }

    @Override
    public Operator getOperator() {
      return operator;
    }

    public Formula getOperand() {
      return operand;
    }

    @Override
    StateSet evaluate(Evaluation evaluation) {
      final var graph = evaluation.getGraph();
      final var target = evaluation.sat(operand);
      switch (operator) {
        case NOT:
          return target.complement();
        case EX:
          return graph.preExists(target);
        case AX:
          return graph.preAll(target);
        case EF:
          return evaluation.leastFixpoint(operator, target, graph::preExists);
        case AF:
          return evaluation.leastFixpoint(operator, target, graph::preAll);
        case EG:
          return evaluation.greatestFixpoint(operator, target, graph::preExists);
        case AG:
          return evaluation.greatestFixpoint(operator, target, graph::preAll);
        default:
          throw new AssertionError("Unsupported unary operator " + operator);
      }
    }

    @Override
    public int hashCode() {
      return 31 * operator.hashCode() + operand.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      } else if (o instanceof Unary) {
        final var that = (Unary) o;
        return operator == that.operator && operand.equals(that.operand);
      } else {
        return false;
      }
    }

    @Override
    public String toString() {
      return operator == Operator.NOT ? "!" + operand : operator + "(" + operand + ")";
    }
  }

  public static final class Binary extends Formula {
    private final Operator operator;

    private final Formula left;

    private final Formula right;

    private Binary(Operator operator, Formula left, Formula right) {
      Assert.argument(left != null && right != null, () -> "Operands of " + operator + " cannot be null");
      this.operator = operator;
      this.left = left;
      this.right = right;
    }

    @Override
    public Operator getOperator() {
      return operator;
    }

    public Formula getLeft() {
      return left;
    }

    public Formula getRight() {
      return right;
    }

    @Override
    StateSet evaluate(Evaluation evaluation) {
      final var graph = evaluation.getGraph();
      final var leftSet = evaluation.sat(left);
      final var rightSet = evaluation.sat(right);
      switch (operator) {
        case AND:
          return leftSet.intersect(rightSet);
        case OR:
          return leftSet.union(rightSet);
        case EU:
          return evaluation.leastFixpoint(operator, rightSet, y -> leftSet.intersect(graph.preExists(y)));
        case AU:
          return evaluation.leastFixpoint(operator, rightSet, y -> leftSet.intersect(graph.preAll(y)));
        default:
          throw new AssertionError("Unsupported binary operator " + operator);
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, left, right);
    }

    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      } else if (o instanceof Binary) {
        final var that = (Binary) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
      } else {
        return false;
      }
    }

    @Override
    public String toString() {
      switch (operator) {
        case AND:
          return "(" + left + " & " + right + ")";
        case OR:
          return "(" + left + " | " + right + ")";
        case EU:
          return "E[" + left + " U " + right + "]";
        default:
          return "A[" + left + " U " + right + "]";
      }
    }
  }
}
