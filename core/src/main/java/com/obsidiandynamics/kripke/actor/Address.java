package com.obsidiandynamics.kripke.actor;

import com.obsidiandynamics.kripke.util.*;

/**
 * Identifies one inbound channel of one actor. No two channels within a {@link World} may share an
 * address.
 */
public final class Address {
  private final String actorId;

  private final String channelName;

  private Address(String actorId, String channelName) {
    this.actorId = actorId;
    this.channelName = channelName;
  }

  public static Address of(String actorId, String channelName) {
    Assert.argument(actorId != null, () -> "Actor ID cannot be null");
    Assert.argument(channelName != null, () -> "Channel name cannot be null");
    return new Address(actorId, channelName);
  }

  public String getActorId() {
    return actorId;
  }

  public String getChannelName() {
    return channelName;
  }

  @Override
  public int hashCode() {
    return 31 * actorId.hashCode() + channelName.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    } else if (o instanceof Address) {
      final var that = (Address) o;
      return actorId.equals(that.actorId) && channelName.equals(that.channelName);
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return actorId + '.' + channelName;
  }
}
