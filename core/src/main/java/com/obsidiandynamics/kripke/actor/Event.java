package com.obsidiandynamics.kripke.actor;

import java.util.*;

/**
 * A record of one delivered message, appended to the {@link World}'s log upon receipt.
 *
 * @param <P> The payload type.
 */
public final class Event<P> {
  private final int time;

  private final long messageId;

  private final long correlationId;

  private final Address from;

  private final Address to;

  private final P payload;

  private final Address replyTo;

  private final int enqueueTime;

  public Event(int time, long messageId, long correlationId, Address from, Address to, P payload,
               Address replyTo, int enqueueTime) {
    this.time = time;
    this.messageId = messageId;
    this.correlationId = correlationId;
    this.from = from;
    this.to = to;
    this.payload = payload;
    this.replyTo = replyTo;
    this.enqueueTime = enqueueTime;
  }

  static <P> Event<P> delivered(Message<P> message, int time) {
    return new Event<>(time, message.getId(), message.getCorrelationId(), message.getFrom(), message.getTo(),
                       message.getPayload(), message.getReplyTo().orElse(null), message.getEnqueueTime());
  }

  public int getTime() {
    return time;
  }

  public long getMessageId() {
    return messageId;
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

  /**
   * The number of ticks the message spent in its channel.
   */
  public int getQueueDelay() {
    return time - enqueueTime;
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, messageId, correlationId, from, to, payload, replyTo, enqueueTime);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof Event) {
      final var that = (Event<?>) o;
      return time == that.time && messageId == that.messageId && correlationId == that.correlationId &&
          enqueueTime == that.enqueueTime && Objects.equals(from, that.from) && Objects.equals(to, that.to) &&
          Objects.equals(payload, that.payload) && Objects.equals(replyTo, that.replyTo);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return Event.class.getSimpleName() + "[time=" + time + ", messageId=" + messageId +
        ", correlationId=" + correlationId + ", from=" + from + ", to=" + to + ", payload=" + payload +
        ", replyTo=" + replyTo + ", enqueueTime=" + enqueueTime + ", queueDelay=" + getQueueDelay() + ']';
  }
}
