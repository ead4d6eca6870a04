package com.mux.sdk.jwt;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A registered time claim value: either a fixed instant or an offset from the signing time.
 */
public final class ClaimTime {
    private final Instant absolute;
    private final Duration offset;

    private ClaimTime(Instant absolute, Duration offset) {
        this.absolute = absolute;
        this.offset = offset;
    }

    public static ClaimTime at(Instant instant) {
        return new ClaimTime(Objects.requireNonNull(instant, "instant"), null);
    }

    public static ClaimTime atEpochSecond(long epochSeconds) {
        return at(Instant.ofEpochSecond(epochSeconds));
    }

    public static ClaimTime in(Duration offset) {
        return new ClaimTime(null, Objects.requireNonNull(offset, "offset"));
    }

    /**
     * @see TimeSpans#parseSeconds(String)
     */
    public static ClaimTime in(String span) {
        return in(Duration.ofSeconds(TimeSpans.parseSeconds(span)));
    }

    public Instant resolve(Instant now) {
        return absolute != null ? absolute : now.plus(offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClaimTime other)) {
            return false;
        }
        return Objects.equals(absolute, other.absolute) && Objects.equals(offset, other.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(absolute, offset);
    }

    @Override
    public String toString() {
        return absolute != null ? absolute.toString() : "now+" + offset;
    }
}
