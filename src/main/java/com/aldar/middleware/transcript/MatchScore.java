package com.aldar.middleware.transcript;

import java.time.Duration;

/**
 * How well a ledger row matches a synthesized message. Stronger kinds always win; within
 * a kind the smaller time distance wins.
 */
public record MatchScore(Kind kind, Duration distance) implements Comparable<MatchScore> {

    public enum Kind {
        RUN_LINK,
        PREFIX_CONTENT,
        EXACT_CONTENT,
        IDENTITY
    }

    public MatchScore {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        distance = distance == null ? Duration.ZERO : distance.abs();
    }

    public boolean isBetterThan(MatchScore other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(MatchScore other) {
        int byKind = Integer.compare(kind.ordinal(), other.kind.ordinal());
        if (byKind != 0) {
            return byKind;
        }
        return other.distance.compareTo(distance);
    }
}
