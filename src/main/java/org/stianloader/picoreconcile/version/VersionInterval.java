package org.stianloader.picoreconcile.version;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A contiguous range of versions with an optional lower and upper bound, each of which
 * may be inclusive or exclusive. A missing bound extends the interval to infinity.
 */
public final class VersionInterval {

    /**
     * Sentinel value denoting that no range was specified at all. It is not an empty range:
     * constraints carrying this interval are matched using their preferred versions instead.
     */
    @NotNull
    public static final VersionInterval ZERO = new VersionInterval(null, null, false, false);

    @Nullable
    private final Version from;
    private final boolean fromIncluded;
    @Nullable
    private final Version to;
    private final boolean toIncluded;

    public VersionInterval(@Nullable Version from, @Nullable Version to, boolean fromIncluded, boolean toIncluded) {
        this.from = from;
        this.to = to;
        this.fromIncluded = fromIncluded;
        this.toIncluded = toIncluded;
    }

    public boolean contains(@NotNull Version version) {
        Version from = this.from;
        if (from != null) {
            int cmp = version.compareTo(from);
            if (cmp < 0 || (cmp == 0 && !this.fromIncluded)) {
                return false;
            }
        }

        Version to = this.to;
        if (to != null) {
            int cmp = version.compareTo(to);
            if (cmp > 0 || (cmp == 0 && !this.toIncluded)) {
                return false;
            }
        }

        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionInterval) {
            VersionInterval other = (VersionInterval) obj;
            return Objects.equals(this.from, other.from)
                    && Objects.equals(this.to, other.to)
                    && this.fromIncluded == other.fromIncluded
                    && this.toIncluded == other.toIncluded;
        }
        return false;
    }

    @Nullable
    public Version getFrom() {
        return this.from;
    }

    /**
     * Obtains the interval in the bracket notation used by maven and ivy, for example "[1.0,2.0)".
     * A closed interval whose bounds are equal is written as a pin, e.g. "[1.0]".
     *
     * @return The string representation of the interval
     */
    @NotNull
    public String getRepr() {
        Version from = this.from;
        Version to = this.to;
        if (from != null && to != null && this.fromIncluded && this.toIncluded && from.compareTo(to) == 0) {
            return "[" + from.getOriginText() + "]";
        }
        return (this.fromIncluded ? "[" : "(")
                + (from == null ? "" : from.getOriginText())
                + ","
                + (to == null ? "" : to.getOriginText())
                + (this.toIncluded ? "]" : ")");
    }

    @Nullable
    public Version getTo() {
        return this.to;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.from, this.to, this.fromIncluded, this.toIncluded);
    }

    public boolean isFromIncluded() {
        return this.fromIncluded;
    }

    public boolean isToIncluded() {
        return this.toIncluded;
    }

    /**
     * Checks whether at least one version could lie within the interval.
     * Unbounded intervals are always valid.
     *
     * @return True if the interval is not empty
     */
    public boolean isValid() {
        Version from = this.from;
        Version to = this.to;
        if (from == null || to == null) {
            return true;
        }
        int cmp = from.compareTo(to);
        return cmp < 0 || (cmp == 0 && this.fromIncluded && this.toIncluded);
    }

    public boolean isZero() {
        return this.equals(VersionInterval.ZERO);
    }

    /**
     * Computes the intersection of two intervals.
     *
     * @param other The interval to intersect with
     * @return The intersection, or null if the intervals do not overlap
     */
    @Nullable
    public VersionInterval merge(@NotNull VersionInterval other) {
        Version from = this.from;
        boolean fromIncluded = this.fromIncluded;
        if (other.from != null) {
            int cmp = from == null ? -1 : from.compareTo(other.from);
            if (cmp < 0) {
                from = other.from;
                fromIncluded = other.fromIncluded;
            } else if (cmp == 0) {
                fromIncluded &= other.fromIncluded;
            }
        }

        Version to = this.to;
        boolean toIncluded = this.toIncluded;
        if (other.to != null) {
            int cmp = to == null ? 1 : to.compareTo(other.to);
            if (cmp > 0) {
                to = other.to;
                toIncluded = other.toIncluded;
            } else if (cmp == 0) {
                toIncluded &= other.toIncluded;
            }
        }

        VersionInterval merged = new VersionInterval(from, to, fromIncluded, toIncluded);
        return merged.isValid() ? merged : null;
    }

    @Override
    public String toString() {
        return this.getRepr();
    }
}
