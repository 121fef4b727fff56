package org.stianloader.picoreconcile.version;

import java.math.BigInteger;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

public final class NumericSegment implements VersionSegment {

    @NotNull
    private final BigInteger value;

    public NumericSegment(@NotNull BigInteger value) {
        this.value = Objects.requireNonNull(value, "value may not be null");
    }

    @Override
    public int compareTo(VersionSegment other) {
        if (other instanceof NumericSegment) {
            return this.value.compareTo(((NumericSegment) other).value);
        }
        return VersionSegment.super.compareTo(other);
    }

    @Override
    public int compareToAbsent() {
        return this.value.signum();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof NumericSegment) {
            return ((NumericSegment) obj).value.equals(this.value);
        }
        return false;
    }

    @NotNull
    public BigInteger getValue() {
        return this.value;
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    @NotNull
    public String repr() {
        return this.value.toString();
    }

    @Override
    public String toString() {
        return this.repr();
    }
}
