package com.sqlpush.translator;

import java.util.Comparator;

/**
 * A remote database version, compared component-wise.
 *
 * @param major major version
 * @param minor minor version
 * @param patch patch version
 */
public record DialectVersion(int major, int minor, int patch) implements Comparable<DialectVersion> {

    private static final Comparator<DialectVersion> ORDER = Comparator
        .comparingInt(DialectVersion::major)
        .thenComparingInt(DialectVersion::minor)
        .thenComparingInt(DialectVersion::patch);

    public DialectVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                "Version components must be non-negative: %d.%d.%d".formatted(major, minor, patch));
        }
    }

    /**
     * Parses {@code major[.minor[.patch]]}. Missing components are zero.
     *
     * @param value the version string, e.g. "7.5.0"
     * @return the parsed version
     * @throws IllegalArgumentException if value is not a version
     */
    public static DialectVersion parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Dialect version must not be empty");
        }
        String[] parts = value.trim().split("\\.");
        if (parts.length > 3) {
            throw new IllegalArgumentException(
                "Invalid dialect version: '%s'. Expected major.minor.patch".formatted(value));
        }
        int[] components = new int[3];
        try {
            for (int i = 0; i < parts.length; i++) {
                components[i] = Integer.parseInt(parts[i]);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid dialect version: '%s'. Expected major.minor.patch".formatted(value), e);
        }
        return new DialectVersion(components[0], components[1], components[2]);
    }

    public boolean atLeast(DialectVersion minimum) {
        return compareTo(minimum) >= 0;
    }

    @Override
    public int compareTo(DialectVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
