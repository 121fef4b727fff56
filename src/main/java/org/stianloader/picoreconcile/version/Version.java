package org.stianloader.picoreconcile.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A parsed version string. Parsing never fails: any string, including the empty string,
 * maps to a version that can be ordered against other versions.
 *
 * <p>Ordering ({@link #compareTo(Version)}) pads the shorter version with absent segments,
 * meaning that "1", "1.0" and "1.0.0" are considered equally new. Equality ({@link #equals(Object)})
 * on the other hand is structural and only holds if both versions consist of the same segments,
 * which is not the case for "1" and "1.0".
 */
public final class Version implements Comparable<Version> {

    // Other unicode digits (e.g. U+1D7CF) end up in qualifiers, BigInteger cannot parse them reliably
    private static boolean isDigit(int codepoint) {
        return codepoint >= '0' && codepoint <= '9';
    }

    private static boolean isSeparator(int codepoint) {
        return codepoint == '.' || codepoint == '-' || codepoint == '_' || codepoint == '+';
    }

    @NotNull
    @Contract(pure = true)
    public static Version parse(@NotNull String string) {
        Objects.requireNonNull(string, "string may not be null");
        List<@NotNull VersionSegment> segments = new ArrayList<>();
        int[] codepoints = string.codePoints().toArray();

        // Whether the previous codepoint was a separator (or the start of the string)
        boolean atBoundary = true;
        int i = 0;
        while (i < codepoints.length) {
            int codepoint = codepoints[i];
            if (Version.isSeparator(codepoint)) {
                if (atBoundary) {
                    segments.add(new QualifierSegment(""));
                }
                atBoundary = true;
                i++;
                continue;
            }

            boolean digits = Version.isDigit(codepoint);
            int start = i;
            while (i < codepoints.length && !Version.isSeparator(codepoints[i]) && Version.isDigit(codepoints[i]) == digits) {
                i++;
            }
            String token = new String(codepoints, start, i - start);
            if (digits) {
                segments.add(new NumericSegment(new BigInteger(token)));
            } else {
                segments.add(new QualifierSegment(token));
            }
            atBoundary = false;
        }

        return new Version(string, segments);
    }

    @NotNull
    private final String originText;

    @NotNull
    private final List<@NotNull VersionSegment> segments;

    private Version(@NotNull String originText, @NotNull List<@NotNull VersionSegment> segments) {
        this.originText = originText;
        this.segments = Collections.unmodifiableList(segments);
    }

    @Override
    public int compareTo(Version other) {
        return VersionSegment.compareSequences(this.segments, other.segments);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Version) {
            return ((Version) obj).segments.equals(this.segments);
        }
        return false;
    }

    /**
     * Obtains the string this version was parsed from, as-is.
     *
     * @return The original version string
     */
    @NotNull
    public String getOriginText() {
        return this.originText;
    }

    @NotNull
    public List<@NotNull VersionSegment> getSegments() {
        return this.segments;
    }

    @Override
    public int hashCode() {
        return this.segments.hashCode();
    }

    /**
     * Checks whether every segment of this version is empty, that is whether this version is
     * as old as the version with no segments at all. Applies to "", "0" and "0.0.final".
     *
     * @return True if the version is empty
     */
    public boolean isEmpty() {
        for (VersionSegment segment : this.segments) {
            if (!segment.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public boolean isNewerThan(@NotNull Version other) {
        return this.compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
