package org.stianloader.picoreconcile.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoreconcile.logging.LoggingAdapter;

/**
 * Parsers turning declared version strings into {@link Version}, {@link VersionInterval}
 * and {@link VersionConstraint} instances.
 *
 * <p>Supported notations are plain versions ("1.2.3"), maven-style intervals ("[1.0,2.0)", "(,1.0]"),
 * pins ("[1.0]"), several intervals that must all hold ("[1.0,),(,2.0)") and ivy's latest sub-revision
 * notation ("1.2.+").
 */
public final class VersionParse {

    private static boolean isIntervalDelimiter(int codepoint) {
        return codepoint == '[' || codepoint == ']' || codepoint == '(' || codepoint == ')';
    }

    /**
     * Parses ivy's "latest sub-revision" notation, where "1.2.+" matches any version starting with "1.2.".
     * The resulting interval is "[1.2,1.3)".
     *
     * @param string The string to parse
     * @return The parsed interval, or null if the string does not use that notation
     */
    @Nullable
    public static VersionInterval ivyLatestSubRevisionInterval(@NotNull String string) {
        if (!string.endsWith(".+")) {
            return null;
        }

        Version from = VersionParse.version(string.substring(0, string.length() - 2));
        if (from == null || from.getSegments().isEmpty()) {
            return null;
        }

        List<@NotNull VersionSegment> segments = from.getSegments();
        VersionSegment last = segments.get(segments.size() - 1);
        if (!(last instanceof NumericSegment)) {
            return null;
        }

        StringBuilder upper = new StringBuilder();
        for (int i = 0; i < segments.size() - 1; i++) {
            upper.append(segments.get(i).repr()).append('.');
        }
        upper.append(((NumericSegment) last).getValue().add(BigInteger.ONE));

        return new VersionInterval(from, Version.parse(upper.toString()), true, false);
    }

    /**
     * Parses a comma-separated list of intervals, all of which must contain a version for the list
     * to contain it.
     *
     * @param string The string to parse
     * @return The intersection of all intervals, or null if a token is not an interval or if the intersection is empty
     */
    @Nullable
    public static VersionInterval multiVersionInterval(@NotNull String string) {
        List<@NotNull String> tokens = new ArrayList<>();
        int[] codepoints = string.codePoints().toArray();

        boolean parsingRange = false;
        int lastDelimiter = -1;
        for (int i = 0; i < codepoints.length; i++) {
            int codepoint = codepoints[i];
            if (codepoint == '(' || codepoint == '[') {
                parsingRange = true;
            } else if (codepoint == ')' || codepoint == ']') {
                parsingRange = false;
            } else if (codepoint == ',' && !parsingRange) {
                tokens.add(new String(codepoints, lastDelimiter + 1, i - lastDelimiter - 1));
                lastDelimiter = i;
            }
        }
        tokens.add(new String(codepoints, lastDelimiter + 1, codepoints.length - lastDelimiter - 1));

        if (tokens.size() < 2) {
            return null;
        }

        VersionInterval merged = null;
        for (String token : tokens) {
            VersionInterval interval = VersionParse.versionInterval(token.trim());
            if (interval == null) {
                return null;
            }
            if (merged == null) {
                merged = interval;
            } else {
                merged = merged.merge(interval);
                if (merged == null) {
                    LoggingAdapter.getDefaultLogger().debug(VersionParse.class, "The intervals of '{}' do not overlap", string);
                    return null;
                }
            }
        }

        return merged;
    }

    /**
     * Parses a plain version string, that is a string that is not a range.
     *
     * @param string The string to parse
     * @return The version, or null if the string is empty or contains interval delimiters, commas or whitespace
     */
    @Nullable
    public static Version version(@NotNull String string) {
        if (string.isEmpty()) {
            return null;
        }
        for (int codepoint : string.codePoints().toArray()) {
            if (codepoint == ',' || VersionParse.isIntervalDelimiter(codepoint) || Character.isWhitespace(codepoint)) {
                return null;
            }
        }
        return Version.parse(string);
    }

    /**
     * Parses an arbitrary declared version, falling back to {@link VersionConstraint#EMPTY} should the string
     * not be understood. This method never throws for malformed input.
     *
     * @param string The string to parse
     * @return The parsed constraint
     */
    @NotNull
    public static VersionConstraint versionConstraint(@NotNull String string) {
        if (string.isEmpty()) {
            return VersionConstraint.EMPTY;
        }

        VersionInterval latest = VersionParse.ivyLatestSubRevisionInterval(string);
        if (latest != null) {
            return VersionConstraint.interval(latest);
        }

        Version version = VersionParse.version(string);
        if (version != null) {
            return VersionConstraint.preferred(version);
        }

        VersionInterval interval = VersionParse.versionInterval(string);
        if (interval == null) {
            interval = VersionParse.multiVersionInterval(string);
        }
        if (interval != null) {
            return VersionConstraint.interval(interval);
        }

        LoggingAdapter.getDefaultLogger().warn(VersionParse.class, "Unable to parse version constraint '{}', it will not match any version", string);
        return VersionConstraint.EMPTY;
    }

    /**
     * Parses a single interval such as "[1.0,2.0)", "(,1.0]", "[1.0,)" or "[1.0]".
     * Bounds that are empty versions (e.g. "0") are treated as absent.
     *
     * @param string The string to parse
     * @return The interval, or null if the string is not a single valid interval
     */
    @Nullable
    public static VersionInterval versionInterval(@NotNull String string) {
        if (string.length() < 2) {
            return null;
        }

        boolean fromIncluded;
        if (string.startsWith("[")) {
            fromIncluded = true;
        } else if (string.startsWith("(")) {
            fromIncluded = false;
        } else {
            return null;
        }

        boolean toIncluded;
        if (string.endsWith("]")) {
            toIncluded = true;
        } else if (string.endsWith(")")) {
            toIncluded = false;
        } else {
            return null;
        }

        String bounds = string.substring(1, string.length() - 1);
        int separatorPos = bounds.indexOf(',');
        VersionInterval interval;
        if (separatorPos == -1) {
            if (!fromIncluded || !toIncluded) {
                // "(1.0" and alike are not a thing
                return null;
            }
            Version pinned = VersionParse.version(bounds);
            if (pinned == null || pinned.isEmpty()) {
                return null;
            }
            interval = new VersionInterval(pinned, pinned, true, true);
        } else {
            String fromString = bounds.substring(0, separatorPos);
            String toString = bounds.substring(separatorPos + 1);
            Version from = null;
            Version to = null;
            if (!fromString.isEmpty()) {
                from = VersionParse.version(fromString);
                if (from == null) {
                    return null;
                }
            }
            if (!toString.isEmpty()) {
                to = VersionParse.version(toString);
                if (to == null) {
                    return null;
                }
            }
            if (from != null && from.isEmpty()) {
                from = null;
            }
            if (to != null && to.isEmpty()) {
                to = null;
            }
            interval = new VersionInterval(from, to, fromIncluded, toIncluded);
        }

        return interval.isValid() ? interval : null;
    }

    private VersionParse() {
        throw new AssertionError();
    }
}
