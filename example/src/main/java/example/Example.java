package example;

import com.obsidiandynamics.kripke.actor.*;
import com.obsidiandynamics.kripke.ctl.*;
import com.obsidiandynamics.kripke.graph.*;

import java.util.*;

import static com.obsidiandynamics.kripke.ctl.Formula.*;

public class Example {
  private static final Address ORDERS = Address.of("kitchen", "orders");

  private static final Address READY = Address.of("waiter", "ready");

  private static class Waiter implements Actor {
    private final List<String> dishes;

    private int taken;

    private int served;

    Waiter(List<String> dishes) {
      this.dishes = dishes;
    }

    @Override
    public String getId() {
      return READY.getActorId();
    }

    @Override
    public List<Step> ready(World world) {
      final var steps = new ArrayList<Step>();
      if (taken < dishes.size() && world.channel(ORDERS).canSend()) {
        steps.add(w -> w.send(Message.of(READY, ORDERS, dishes.get(taken++), READY)));
      }
      if (world.channel(READY).canRecv()) {
        steps.add(w -> w.<String>receive(READY).ifPresent(dish -> served++));
      }
      return steps;
    }
  }

  private static class Kitchen implements Actor {
    @Override
    public String getId() {
      return ORDERS.getActorId();
    }

    @Override
    public List<Step> ready(World world) {
      final Channel<String> orders = world.channel(ORDERS);
      if (orders.canRecv() && world.channel(READY).canSend()) {
        return List.of(w -> w.<String>receive(ORDERS).ifPresent(order -> {
          w.send(Message.replyTo(order, ORDERS, order.getPayload() + " (cooked)"));
        }));
      } else {
        return List.of();
      }
    }
  }

  public static void main(String[] args) {
    simulate();
    System.out.println();
    check();
  }

  private static void simulate() {
    final var waiter = new Waiter(List.of("soup", "salad", "steak", "pie"));
    final var world = new World(List.of(waiter, new Kitchen()),
                                List.of(new Channel<String>(ORDERS.getActorId(), ORDERS.getChannelName(), 2),
                                        new Channel<String>(READY.getActorId(), READY.getChannelName(), 1)),
                                42);

    final var steps = world.runSteps(1_000);
    System.out.format("Simulation quiesced after %d steps; %d dish(es) served\n", steps, waiter.served);
    for (var event : world.events()) {
      System.out.format("  t=%d %s -> %s: %s (waited %d)\n",
                        event.getTime(), event.getFrom(), event.getTo(), event.getPayload(), event.getQueueDelay());
    }
  }

  private static void check() {
    final var graph = new Graph();
    graph.addState("idle", "waiter_free");
    graph.addState("ordered", "order_pending");
    graph.addState("cooking", "order_pending", "kitchen_busy");
    graph.addState("served", "waiter_free", "dish_served");
    graph.addEdge("idle", "ordered");
    graph.addEdge("ordered", "cooking");
    graph.addEdge("cooking", "served");
    graph.addEdge("served", "idle");
    graph.setInitial("idle");

    final var requirements = List.of(
        Requirement.of("E1", "Every order is eventually served", ag(implies(atom("order_pending"), af(atom("dish_served"))))),
        Requirement.of("E2", "The kitchen is only busy with an order", ag(implies(atom("kitchen_busy"), atom("order_pending")))),
        Requirement.of("E3", "The waiter is always free again", ag(ef(atom("waiter_free")))));

    final var evaluation = Evaluation.over(graph);
    for (var requirement : requirements) {
      final var verdict = requirement.check(evaluation);
      System.out.format("%s %-40s %-5s %s\n",
                        requirement.getId(), requirement.getDescription(), verdict.holds() ? "PASS" : "FAIL",
                        requirement.getFormula());
    }
  }
}
