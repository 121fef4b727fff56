package org.stianloader.picoreconcile.version;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * A non-numeric {@link VersionSegment}, such as "rc", "SNAPSHOT" or "final".
 * The text is stored in lower case, rendering "RC" and "rc" equivalent.
 *
 * <p>An empty qualifier is produced by a leading separator (".5") or by two consecutive
 * separators ("1..2").
 */
public final class QualifierSegment implements VersionSegment {

    private static final int RANK_RELEASE = 0;
    private static final int RANK_UNKNOWN = 2;

    private static int rankOf(@NotNull String qualifier) {
        switch (qualifier) {
        case "alpha":
        case "a":
            return -5;
        case "beta":
        case "b":
            return -4;
        case "milestone":
        case "m":
            return -3;
        case "rc":
        case "cr":
            return -2;
        case "snapshot":
            return -1;
        case "":
        case "ga":
        case "final":
        case "release":
            return QualifierSegment.RANK_RELEASE;
        case "sp":
            return 1;
        default:
            return QualifierSegment.RANK_UNKNOWN;
        }
    }

    private final int rank;

    @NotNull
    private final String text;

    public QualifierSegment(@NotNull String text) {
        this.text = Objects.requireNonNull(text, "text may not be null").toLowerCase(Locale.ROOT);
        this.rank = QualifierSegment.rankOf(this.text);
    }

    @Override
    public int compareTo(VersionSegment other) {
        if (other instanceof QualifierSegment) {
            QualifierSegment qualifier = (QualifierSegment) other;
            if (this.rank != qualifier.rank) {
                return Integer.compare(this.rank, qualifier.rank);
            } else if (this.rank == QualifierSegment.RANK_UNKNOWN) {
                return this.text.compareTo(qualifier.text);
            }
            // Aliases such as "cr" and "rc" are equivalent
            return 0;
        }
        return VersionSegment.super.compareTo(other);
    }

    @Override
    public int compareToAbsent() {
        return Integer.signum(this.rank);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof QualifierSegment) {
            return ((QualifierSegment) obj).text.equals(this.text);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return this.text.hashCode();
    }

    @Override
    public boolean isNumeric() {
        return false;
    }

    public boolean isPreRelease() {
        return this.rank < QualifierSegment.RANK_RELEASE;
    }

    @Override
    @NotNull
    public String repr() {
        return this.text;
    }

    @Override
    public String toString() {
        return this.repr();
    }
}
