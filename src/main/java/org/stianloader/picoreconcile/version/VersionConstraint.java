package org.stianloader.picoreconcile.version;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * The parsed form of a dependency's declared version. A constraint is either a range
 * (an {@link VersionInterval} other than {@link VersionInterval#ZERO}) or a set of preferred versions,
 * never both: if the interval is set, the preferred versions are not taken into account.
 *
 * <p>Instances are obtained through {@link VersionParse#versionConstraint(String)}.
 */
public final record VersionConstraint(@NotNull VersionInterval interval, @NotNull List<@NotNull Version> preferred) {

    /**
     * A constraint with neither a range nor a preferred version. This is what the empty string
     * as well as any unparseable string map to.
     */
    @NotNull
    public static final VersionConstraint EMPTY = new VersionConstraint(VersionInterval.ZERO, Collections.emptyList());

    @NotNull
    public static VersionConstraint interval(@NotNull VersionInterval interval) {
        return new VersionConstraint(interval, Collections.emptyList());
    }

    @NotNull
    public static VersionConstraint preferred(@NotNull Version version) {
        return new VersionConstraint(VersionInterval.ZERO, Collections.singletonList(version));
    }

    public VersionConstraint {
        Objects.requireNonNull(interval, "interval may not be null");
        preferred = List.copyOf(preferred);
    }

    public boolean hasInterval() {
        return !this.interval.isZero();
    }

    @Override
    public String toString() {
        if (this.hasInterval()) {
            return this.interval.getRepr();
        }
        StringBuilder builder = new StringBuilder();
        for (Version version : this.preferred) {
            builder.append(version.getOriginText()).append(',');
        }
        if (builder.length() != 0) {
            builder.setLength(builder.length() - 1);
        }
        return builder.toString();
    }
}
