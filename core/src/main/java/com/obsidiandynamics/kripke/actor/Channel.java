package com.obsidiandynamics.kripke.actor;

import com.obsidiandynamics.kripke.util.*;
import org.slf4j.*;

import java.util.*;

/**
 * A bounded FIFO queue owned by a single actor. The buffer changes only through {@link #trySend} and
 * {@link #tryRecv}, each of which checks admission first; hence {@code 0 <= size() <= capacity()} holds
 * at all times.<p>
 *
 * Rendezvous (zero-capacity) channels are not supported: a capacity of 0 is promoted to 1.
 *
 * @param <P> The payload type.
 */
public final class Channel<P> {
  private static final Logger log = LoggerFactory.getLogger(Channel.class);

  private final Address address;

  private final int capacity;

  private final Deque<Message<P>> buffer = new ArrayDeque<>();

  public Channel(String ownerId, String name, int capacity) {
    Assert.argument(capacity >= 0, () -> "Capacity cannot be negative: " + capacity);
    address = Address.of(ownerId, name);
    if (capacity == 0) {
      log.warn("Rendezvous channels are not supported; promoting {} to capacity 1", address);
      this.capacity = 1;
    } else {
      this.capacity = capacity;
    }
  }

  public Address getAddress() {
    return address;
  }

  public String getOwnerId() {
    return address.getActorId();
  }

  public String getName() {
    return address.getChannelName();
  }

  public int getCapacity() {
    return capacity;
  }

  public int size() {
    return buffer.size();
  }

  public boolean isEmpty() {
    return buffer.isEmpty();
  }

  public boolean isFull() {
    return buffer.size() >= capacity;
  }

  public boolean canSend() {
    return buffer.size() < capacity;
  }

  public boolean canRecv() {
    return ! buffer.isEmpty();
  }

  /**
   * Enqueues a message if there is room.
   *
   * @param message The message.
   * @return {@code true} if the message was enqueued; {@code false} if the channel is full, in which case
   *         the channel is left unchanged.
   */
  public boolean trySend(Message<P> message) {
    if (! canSend()) {
      return false;
    }
    buffer.addLast(message);
    return true;
  }

  /**
   * Dequeues the oldest message, if there is one.
   */
  public Optional<Message<P>> tryRecv() {
    return Optional.ofNullable(buffer.pollFirst());
  }

  public Optional<Message<P>> peek() {
    return Optional.ofNullable(buffer.peekFirst());
  }

  @Override
  public String toString() {
    return Channel.class.getSimpleName() + "[address=" + address + ", size=" + buffer.size() + ", capacity=" + capacity + ']';
  }
}
