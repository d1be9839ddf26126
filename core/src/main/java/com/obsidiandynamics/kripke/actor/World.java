package com.obsidiandynamics.kripke.actor;

import org.slf4j.*;

import com.obsidiandynamics.kripke.util.*;

import java.util.*;

/**
 * A discrete-event simulation of actors communicating over bounded channels.<p>
 *
 * Each tick, every actor is polled in registration order for its enabled steps; the candidate lists are
 * flattened and exactly one step is drawn uniformly at random, executed to completion, and the clock
 * advances by one. When no actor offers a step the world is quiescent: nothing happens and time stands
 * still.<p>
 *
 * Scheduling decisions draw on a dedicated {@link SplittableRandom}, so a given seed reproduces the same
 * event log for the same actors and channels.
 */
public final class World {
  private static final Logger log = LoggerFactory.getLogger(World.class);

  private final List<Actor> actors;

  private final Map<Address, Channel<?>> channels = new LinkedHashMap<>();

  private final List<Event<?>> events = new ArrayList<>();

  private final long seed;

  private final SplittableRandom random;

  private int time;

  private long nextMessageId = 1;

  /**
   * Creates a world.
   *
   * @param actors The actors, in polling order.
   * @param channels The channels; no two may share an address.
   * @param seed The scheduler seed; 0 selects a time-derived seed.
   * @throws DuplicateChannelException If two channels share an address.
   */
  public World(List<? extends Actor> actors, List<? extends Channel<?>> channels, long seed) {
    this.actors = List.copyOf(actors);
    for (var channel : channels) {
      final var existing = this.channels.putIfAbsent(channel.getAddress(), channel);
      if (existing != null) {
        throw new DuplicateChannelException("Duplicate channel " + channel.getAddress());
      }
    }
    this.seed = seed != 0 ? seed : deriveSeed();
    random = new SplittableRandom(this.seed);
    log.debug("Created world with {} actor(s), {} channel(s), seed {}", this.actors.size(), this.channels.size(), this.seed);
  }

  private static long deriveSeed() {
    final var derived = System.nanoTime() ^ System.currentTimeMillis() << 21;
    return derived != 0 ? derived : 1;
  }

  public long getSeed() {
    return seed;
  }

  public int getTime() {
    return time;
  }

  public List<Actor> getActors() {
    return actors;
  }

  public Collection<Channel<?>> getChannels() {
    return Collections.unmodifiableCollection(channels.values());
  }

  /**
   * The delivery log, ordered by delivery tick.
   */
  public List<Event<?>> events() {
    return Collections.unmodifiableList(events);
  }

  /**
   * Looks up a registered channel.
   *
   * @param <P> The payload type that the caller expects the channel to carry.
   * @param address The channel address.
   * @return The channel.
   * @throws UnknownChannelAssertionError If no channel is registered under {@code address}.
   */
  @SuppressWarnings("unchecked")
  public <P> Channel<P> channel(Address address) {
    final var channel = channels.get(address);
    if (channel == null) {
      throw new UnknownChannelAssertionError("No channel registered at " + address);
    }
    return (Channel<P>) channel;
  }

  public List<Step> enabledSteps() {
    final var candidates = new ArrayList<Step>();
    for (var actor : actors) {
      candidates.addAll(actor.ready(this));
    }
    return candidates;
  }

  /**
   * Executes one uniformly chosen enabled step.
   *
   * @return {@code true} if a step was executed; {@code false} if the world is quiescent.
   */
  public boolean stepRandom() {
    final var candidates = enabledSteps();
    if (candidates.isEmpty()) {
      log.debug("Quiescent at time {}", time);
      return false;
    }
    final var step = candidates.get(random.nextInt(candidates.size()));
    log.trace("Time {}: executing 1 of {} enabled step(s)", time, candidates.size());
    step.execute(this);
    time++;
    return true;
  }

  /**
   * Runs until quiescence or until {@code maxSteps} steps have executed, whichever comes first.
   *
   * @return The number of steps executed.
   */
  public int runSteps(int maxSteps) {
    var steps = 0;
    while (steps < maxSteps && stepRandom()) {
      steps++;
    }
    return steps;
  }

  /**
   * Sends a message to the channel it is addressed to, assigning it a fresh ID and stamping it with the
   * current time.
   *
   * @return {@code true} if the message was enqueued; {@code false} if the channel was full. The latter
   *         means an actor offered a step without checking {@link Channel#canSend()} first.
   */
  public <P> boolean send(Message<P> message) {
    final Channel<P> channel = channel(message.getTo());
    if (! channel.canSend()) {
      log.warn("Dropped send to full channel {} at time {}: {}", channel.getAddress(), time, message);
      return false;
    }
    final var stamped = message.stamp(nextMessageId++, time);
    channel.trySend(stamped);
    return true;
  }

  public <P> Optional<Message<P>> receive(Address address) {
    final Channel<P> channel = channel(address);
    return receive(channel);
  }

  /**
   * Dequeues the oldest message from the given channel, logging its delivery as an {@link Event}.
   *
   * Every queued message must have entered through {@link #send(Message)}; one placed directly with
   * {@link Channel#trySend(Message)} carries no id or enqueue time, and fails with an {@link AssertionError},
   * leaving the channel untouched.
   *
   * @return The message, or empty if the channel was empty. The latter means an actor offered a step
   *         without checking {@link Channel#canRecv()} first.
   */
  public <P> Optional<Message<P>> receive(Channel<P> channel) {
    if (channels.get(channel.getAddress()) != channel) {
      throw new UnknownChannelAssertionError("Channel " + channel.getAddress() + " is not registered");
    }
    channel.peek().ifPresent(head -> {
      Assert.that(head.getId() != Message.UNASSIGNED,
                  () -> "Unstamped message " + head + " in channel " + channel.getAddress() + "; enqueue via World.send()");
    });
    final var message = channel.tryRecv();
    if (message.isPresent()) {
      events.add(Event.delivered(message.get(), time));
    } else {
      log.warn("Empty receive from channel {} at time {}", channel.getAddress(), time);
    }
    return message;
  }

  @Override
  public String toString() {
    return World.class.getSimpleName() + "[time=" + time + ", seed=" + seed + ", actors=" + actors.size() +
        ", channels=" + channels.values() + ", events=" + events.size() + ']';
  }
}
