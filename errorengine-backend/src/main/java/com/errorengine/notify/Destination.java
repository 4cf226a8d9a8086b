package com.errorengine.notify;

import com.errorengine.model.NotificationChannel;

import java.util.Locale;
import java.util.Objects;

/**
 * Where a notification goes: an e-mail address or a configured channel. Equality uses the kind and
 * the address only, so the same mailbox reached through several rules aggregates into one entry.
 */
public final class Destination {

    public enum Kind {
        EMAIL, CHANNEL
    }

    private final Kind kind;
    private final String address;
    private final NotificationChannel channel;

    private Destination(Kind kind, String address, NotificationChannel channel) {
        this.kind = kind;
        this.address = address;
        this.channel = channel;
    }

    public static Destination email(String address) {
        return new Destination(Kind.EMAIL, address.trim().toLowerCase(Locale.ROOT), null);
    }

    public static Destination channel(NotificationChannel channel) {
        Objects.requireNonNull(channel.getId(), "channel id");
        return new Destination(Kind.CHANNEL, "channel:" + channel.getId(), channel);
    }

    public Kind getKind() {
        return kind;
    }

    public String getAddress() {
        return address;
    }

    /**
     * @return the channel for {@link Kind#CHANNEL} destinations, null for e-mail
     */
    public NotificationChannel getChannel() {
        return channel;
    }

    public String describe() {
        return kind == Kind.EMAIL ? address : channel.getType() + ":" + channel.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Destination other)) {
            return false;
        }
        return kind == other.kind && address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, address);
    }

    @Override
    public String toString() {
        return describe();
    }
}
