package org.stianloader.picoreconcile.version;

import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * A single component of a {@link Version}, as obtained by splitting the version string
 * at separators and at digit/non-digit boundaries.
 *
 * <p>Segments are ordered relative to each other as well as relative to an absent segment,
 * which is what a shorter version is padded with when compared against a longer one.
 */
public sealed interface VersionSegment extends Comparable<VersionSegment> permits NumericSegment, QualifierSegment {

    /**
     * Compares two segment sequences, padding the shorter one with absent segments.
     *
     * @param a The first sequence
     * @param b The second sequence
     * @return A negative integer, zero, or a positive integer as {@code a} is older than, equal to or newer than {@code b}
     */
    static int compareSequences(@NotNull List<@NotNull VersionSegment> a, @NotNull List<@NotNull VersionSegment> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        for (int i = common; i < a.size(); i++) {
            int cmp = a.get(i).compareToAbsent();
            if (cmp != 0) {
                return cmp;
            }
        }
        for (int i = common; i < b.size(); i++) {
            int cmp = b.get(i).compareToAbsent();
            if (cmp != 0) {
                return -cmp;
            }
        }
        return 0;
    }

    /**
     * Obtains the sign of this segment when compared against a segment that does not exist.
     * "1.0-rc1" is older than "1.0", thus the "rc" qualifier yields -1.
     *
     * @return -1, 0 or 1
     */
    int compareToAbsent();

    @Override
    default int compareTo(VersionSegment other) {
        int rel0 = this.compareToAbsent();
        int rel1 = other.compareToAbsent();
        if (rel0 != rel1) {
            return Integer.compare(rel0, rel1);
        } else if (rel0 == 0) {
            // "0", "" and "final" are all as good as nothing
            return 0;
        }
        // Same standing relative to the absent segment, numbers win over qualifiers
        return Boolean.compare(this.isNumeric(), other.isNumeric());
    }

    default boolean isEmpty() {
        return this.compareToAbsent() == 0;
    }

    boolean isNumeric();

    /**
     * Obtains the canonical textual representation of this segment, without any separators.
     *
     * @return The string representation
     */
    @NotNull
    String repr();
}
