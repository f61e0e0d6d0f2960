package io.voterelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque identifier of an account allowed to vote. Values are compared
 * after trimming; blank identifiers are rejected.
 */
public record SignerId(String value) implements Comparable<SignerId> {
    public SignerId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Signer id must not be blank");
        }
        value = value.trim();
    }

    @JsonCreator
    public static SignerId of(String raw) {
        return new SignerId(raw);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(SignerId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
