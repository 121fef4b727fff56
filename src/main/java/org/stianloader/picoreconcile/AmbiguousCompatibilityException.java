package org.stianloader.picoreconcile;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a compatibility policy is requested by a name that could stand for more than
 * one {@link VersionCompatibility}. Unlike an unknown name, which is merely absent from
 * {@link VersionCompatibility#fromName(String)}, this is not meant to be recovered from:
 * the configuration must be changed to name the intended policy explicitly.
 */
public class AmbiguousCompatibilityException extends IllegalStateException {

    private static final long serialVersionUID = 6153017385736221482L;

    @NotNull
    private final String policyName;

    public AmbiguousCompatibilityException(@NotNull String policyName, @NotNull String message) {
        super(message);
        this.policyName = policyName;
    }

    /**
     * Obtains the name that was passed to {@link VersionCompatibility#fromName(String)}.
     *
     * @return The ambiguous name
     */
    @NotNull
    public String getPolicyName() {
        return this.policyName;
    }
}
