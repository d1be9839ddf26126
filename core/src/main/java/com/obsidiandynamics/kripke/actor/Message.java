package com.obsidiandynamics.kripke.actor;

import com.obsidiandynamics.kripke.util.*;

import java.util.*;

/**
 * A message in flight between two actors. Messages are immutable; the {@link World} stamps a message
 * with its ID, correlation ID and enqueue time as it is sent.<p>
 *
 * A request typically correlates to itself (its correlation ID defaults to its own ID); a reply created
 * with {@link #replyTo(Message, Address, Object)} inherits the correlation ID of its request.
 *
 * @param <P> The payload type.
 */
public final class Message<P> {
  static final long UNASSIGNED = 0;

  private final long id;

  private final long correlationId;

  private final Address from;

  private final Address to;

  private final P payload;

  private final Address replyTo;

  private final int enqueueTime;

  private Message(long id, long correlationId, Address from, Address to, P payload, Address replyTo, int enqueueTime) {
    this.id = id;
    this.correlationId = correlationId;
    this.from = from;
    this.to = to;
    this.payload = payload;
    this.replyTo = replyTo;
    this.enqueueTime = enqueueTime;
  }

  public static <P> Message<P> of(Address from, Address to, P payload) {
    return of(from, to, payload, null);
  }

  public static <P> Message<P> of(Address from, Address to, P payload, Address replyTo) {
    Assert.argument(from != null, () -> "Sender address cannot be null");
    Assert.argument(to != null, () -> "Recipient address cannot be null");
    return new Message<>(UNASSIGNED, UNASSIGNED, from, to, payload, replyTo, -1);
  }

  /**
   * Creates a reply to {@code request}, addressed to the request's reply address and carrying the
   * request's correlation ID.
   */
  public static <P> Message<P> replyTo(Message<?> request, Address from, P payload) {
    Assert.argument(request.replyTo != null, () -> "Request " + request + " has no reply address");
    return new Message<>(UNASSIGNED, request.correlationId, from, request.replyTo, payload, null, -1);
  }

  Message<P> stamp(long id, int enqueueTime) {
    final var correlationId = this.correlationId != UNASSIGNED ? this.correlationId : id;
    return new Message<>(id, correlationId, from, to, payload, replyTo, enqueueTime);
  }

  public long getId() {
    return id;
  }

  public long getCorrelationId() {
    return correlationId;
  }

  public Address getFrom() {
    return from;
  }

  public Address getTo() {
    return to;
  }

  public P getPayload() {
    return payload;
  }

  public Optional<Address> getReplyTo() {
    return Optional.ofNullable(replyTo);
  }

  public int getEnqueueTime() {
    return enqueueTime;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, correlationId, from, to, payload, replyTo, enqueueTime);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof Message) {
      final var that = (Message<?>) o;
      return id == that.id && correlationId == that.correlationId && enqueueTime == that.enqueueTime &&
          Objects.equals(from, that.from) && Objects.equals(to, that.to) &&
          Objects.equals(payload, that.payload) && Objects.equals(replyTo, that.replyTo);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return Message.class.getSimpleName() + "[id=" + id + ", correlationId=" + correlationId + ", from=" + from +
        ", to=" + to + ", payload=" + payload + ", replyTo=" + replyTo + ", enqueueTime=" + enqueueTime + ']';
  }
}
