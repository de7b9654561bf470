package org.pixelbattle.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Opaque, unique identifier of an actor competing for cells. The ledger never interprets the value;
 * it only compares identifiers for equality.
 *
 * @param value the non-blank identifier (e.g. a wallet address)
 */
public record ActorId(String value) implements Comparable<ActorId> {

    public ActorId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Actor id must not be blank.");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ActorId of(final String value) {
        return new ActorId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(final ActorId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
