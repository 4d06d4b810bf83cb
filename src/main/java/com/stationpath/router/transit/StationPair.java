package com.stationpath.router.transit;

import java.util.Objects;

/**
 * An ordered pair of station ids, the key under which the single edge between two stations is stored.
 * (a, b) and (b, a) are different pairs.
 */
public class StationPair {

    public final String from;

    public final String to;

    public StationPair (String from, String to) {
        this.from = from;
        this.to = to;
    }

    public boolean isSelfLoop () {
        return Objects.equals(from, to);
    }

    @Override
    public boolean equals (Object o) {
        if (!(o instanceof StationPair)) return false;
        StationPair other = (StationPair) o;
        return Objects.equals(from, other.from) && Objects.equals(to, other.to);
    }

    @Override
    public int hashCode () {
        return Objects.hashCode(from) * 31 + Objects.hashCode(to);
    }

    @Override
    public String toString () {
        return String.format("(%s -> %s)", from, to);
    }

}
