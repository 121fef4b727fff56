package org.stianloader.picoreconcile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoreconcile.logging.LoggingAdapter;
import org.stianloader.picoreconcile.version.Version;
import org.stianloader.picoreconcile.version.VersionConstraint;
import org.stianloader.picoreconcile.version.VersionParse;
import org.stianloader.picoreconcile.version.VersionSegment;

/**
 * The strategy used to decide whether a version can stand in for another one when
 * reconciling a dependency conflict.
 *
 * <p>If the declared constraint is a range, all policies but {@link #ALWAYS} accept exactly
 * the versions within the range. The policies only differ in how a plain declared version,
 * such as "1.2.0", is extended to the versions that are compatible with it.
 *
 * <p>All policies are stateless and can be used from any thread.
 */
public enum VersionCompatibility {

    /**
     * The policy used when no other policy is configured, behaves like {@link #PACKVER}.
     */
    DEFAULT("package versioning policy") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            return PACKVER.matchesPreferred(wanted, version);
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return PACKVER.minimumCompatibleVersion(version);
        }
    },

    /**
     * Accepts any version, even if it lies outside of the declared range.
     */
    ALWAYS("always compatible") {
        @Override
        public boolean isCompatible(@NotNull String constraint, @NotNull String version) {
            return true;
        }

        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            return true;
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return "0";
        }
    },

    /**
     * Only accepts the declared version itself, or any version within the declared range.
     * Note that "1.0" and "1.0.0" are distinct versions under this policy.
     */
    STRICT("strict") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            return wanted.equals(version);
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return version;
        }
    },

    /**
     * Old name of {@link #EARLY_SEMVER}.
     *
     * @deprecated Ambiguous, use {@link #EARLY_SEMVER} or {@link #SEMVER_SPEC} instead.
     */
    @Deprecated
    SEMVER("early semantic versioning") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            return EARLY_SEMVER.matchesPreferred(wanted, version);
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return EARLY_SEMVER.minimumCompatibleVersion(version);
        }
    },

    /**
     * Semantic versioning as commonly practiced before 1.0.0: the major version must match and
     * the rest of the declared version may not be newer. However, if the major version is 0
     * (or otherwise empty), the minor version must match as well. That is "0.6.0" and "0.6.1"
     * are compatible, but "0.6.0" and "0.7.0" are not.
     */
    EARLY_SEMVER("early semantic versioning") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            int prefixLength = VersionCompatibility.significantPrefixLength(version);
            return VersionCompatibility.isAllNumeric(wanted.getSegments())
                    && VersionCompatibility.prefix(wanted, prefixLength).equals(VersionCompatibility.prefix(version, prefixLength))
                    && VersionSegment.compareSequences(VersionCompatibility.suffix(wanted, prefixLength), VersionCompatibility.suffix(version, prefixLength)) <= 0;
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            Version parsed = Version.parse(version);
            return VersionCompatibility.lowerBound(parsed, VersionCompatibility.significantPrefixLength(parsed), false);
        }
    },

    /**
     * Semantic versioning as defined by semver.org: versions are compatible if their major version
     * matches and the declared version is not newer. Versions with a major version of 0 are never
     * compatible with any other version.
     */
    SEMVER_SPEC("strict semantic versioning") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            List<@NotNull VersionSegment> major = VersionCompatibility.prefix(version, 1);
            return VersionCompatibility.isAllNumeric(wanted.getSegments())
                    && VersionCompatibility.prefix(wanted, 1).equals(major)
                    && !major.isEmpty() && !major.get(0).isEmpty()
                    && VersionSegment.compareSequences(VersionCompatibility.suffix(wanted, 1), VersionCompatibility.suffix(version, 1)) <= 0;
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return VersionCompatibility.lowerBound(Version.parse(version), 1, true);
        }
    },

    /**
     * The Haskell package versioning policy: "major.minor" must match, anything beyond that
     * is assumed to be compatible regardless of whether it is older or newer.
     */
    PACKVER("package versioning policy") {
        @Override
        protected boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version) {
            return VersionCompatibility.prefix(wanted, 2).equals(VersionCompatibility.prefix(version, 2));
        }

        @Override
        @NotNull
        public String minimumCompatibleVersion(@NotNull String version) {
            return VersionCompatibility.lowerBound(Version.parse(version), 2, false);
        }
    };

    /**
     * Looks up a policy by the name it is configured with. Recognised names are "default", "always",
     * "strict", "early-semver", "semver-spec" and "pvp".
     *
     * <p>The name "semver" is rejected with an {@link AmbiguousCompatibilityException}, as it could
     * mean both {@link #EARLY_SEMVER} and {@link #SEMVER_SPEC} - and picking the wrong one would silently
     * change which versions get resolved.
     *
     * @param name The configured name
     * @return The policy, or an empty optional if the name is not known
     * @throws AmbiguousCompatibilityException If the name is "semver"
     */
    @NotNull
    public static Optional<VersionCompatibility> fromName(@NotNull String name) {
        switch (Objects.requireNonNull(name, "name may not be null")) {
        case "default":
            return Optional.of(DEFAULT);
        case "always":
            return Optional.of(ALWAYS);
        case "strict":
            return Optional.of(STRICT);
        case "early-semver":
            return Optional.of(EARLY_SEMVER);
        case "semver-spec":
            return Optional.of(SEMVER_SPEC);
        case "pvp":
            return Optional.of(PACKVER);
        case "semver":
            throw new AmbiguousCompatibilityException(name, "'semver' is ambiguous.\n"
                    + "Based on the Semantic Versioning 2.0.0, 0.y.z updates are all initial development and thus\n"
                    + "0.6.0 and 0.6.1 would NOT maintain any compatibility, but in many ecosystems it is\n"
                    + "common to start adopting binary compatibility even in 0.y.z releases.\n"
                    + "\n"
                    + "Specify 'early-semver' for the early variant.\n"
                    + "Specify 'semver-spec' for the spec-correct SemVer.");
        default:
            LoggingAdapter.getDefaultLogger().debug(VersionCompatibility.class, "Unknown version compatibility policy '{}'", name);
            return Optional.empty();
        }
    }

    private static boolean isAllNumeric(@NotNull List<@NotNull VersionSegment> segments) {
        for (VersionSegment segment : segments) {
            if (!segment.isNumeric()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders the first segments of a version as the lowest version that is still compatible with it.
     * If these segments aren't all numeric or if the rendered version would be newer than the
     * version itself (as is the case for pre-releases), the version is returned unchanged.
     */
    @NotNull
    private static String lowerBound(@NotNull Version version, int prefixLength, boolean requireNonEmpty) {
        List<@NotNull VersionSegment> prefix = VersionCompatibility.prefix(version, prefixLength);
        if (!VersionCompatibility.isAllNumeric(prefix)) {
            return version.getOriginText();
        }
        if (requireNonEmpty) {
            if (prefix.isEmpty()) {
                return version.getOriginText();
            }
            for (VersionSegment segment : prefix) {
                if (segment.isEmpty()) {
                    return version.getOriginText();
                }
            }
        }

        StringBuilder builder = new StringBuilder();
        for (VersionSegment segment : prefix) {
            if (builder.length() != 0) {
                builder.append('.');
            }
            builder.append(segment.repr());
        }

        String candidate = builder.toString();
        if (Version.parse(candidate).compareTo(version) <= 0) {
            return candidate;
        }
        return version.getOriginText();
    }

    @NotNull
    private static List<@NotNull VersionSegment> prefix(@NotNull Version version, int length) {
        List<@NotNull VersionSegment> segments = version.getSegments();
        return segments.subList(0, Math.min(length, segments.size()));
    }

    // A version with an empty major ("0.6.1", ".6.1") is still in initial development, making the minor version significant
    private static int significantPrefixLength(@NotNull Version version) {
        List<@NotNull VersionSegment> segments = version.getSegments();
        return !segments.isEmpty() && segments.get(0).isEmpty() ? 2 : 1;
    }

    @NotNull
    private static List<@NotNull VersionSegment> suffix(@NotNull Version version, int offset) {
        List<@NotNull VersionSegment> segments = version.getSegments();
        return segments.subList(Math.min(offset, segments.size()), segments.size());
    }

    @NotNull
    private final String name;

    private VersionCompatibility(@NotNull String name) {
        this.name = name;
    }

    /**
     * Obtains a human-readable description of the policy, for use in diagnostics.
     * This is not the name accepted by {@link #fromName(String)}.
     *
     * @return The description of the policy
     */
    @NotNull
    public String getName() {
        return this.name;
    }

    /**
     * Checks whether a version satisfies a declared version constraint under this policy.
     * Malformed input never causes an exception, it merely fails to match.
     *
     * @param constraint The declared constraint, either a version or a range
     * @param version The concrete version
     * @return True if the version is compatible with the constraint
     */
    public boolean isCompatible(@NotNull String constraint, @NotNull String version) {
        if (constraint.equals(version)) {
            return true;
        }

        VersionConstraint parsedConstraint = VersionParse.versionConstraint(constraint);
        Version parsedVersion = Version.parse(version);
        if (parsedConstraint.hasInterval()) {
            return parsedConstraint.interval().contains(parsedVersion);
        }

        for (Version wanted : parsedConstraint.preferred()) {
            if (this.matchesPreferred(wanted, parsedVersion)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a concrete version is compatible with a version that was explicitly declared.
     * Only invoked when the constraint is not a range.
     *
     * @param wanted The declared version
     * @param version The concrete version
     * @return True if the versions are compatible
     */
    protected abstract boolean matchesPreferred(@NotNull Version wanted, @NotNull Version version);

    /**
     * Computes the oldest version that the given version would still be compatible with, that is
     * the version that should be used as the lower bound when looking for compatible versions.
     * The returned version is never newer than the given version. If no such version can be
     * derived, the given version is returned.
     *
     * @param version The version
     * @return The oldest compatible version
     */
    @NotNull
    public abstract String minimumCompatibleVersion(@NotNull String version);
}
