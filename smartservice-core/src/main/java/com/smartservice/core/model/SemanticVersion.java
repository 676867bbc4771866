package com.smartservice.core.model;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version triple {@code major.minor.patch}.
 *
 * @param major major version, non-negative
 * @param minor minor version, non-negative
 * @param patch patch version, non-negative
 */
public record SemanticVersion(
    int major,
    int minor,
    int patch
) implements Comparable<SemanticVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private static final Comparator<SemanticVersion> ORDER = Comparator
        .comparingInt(SemanticVersion::major)
        .thenComparingInt(SemanticVersion::minor)
        .thenComparingInt(SemanticVersion::patch);

    /**
     * Compact constructor with validation.
     */
    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                "version components must be non-negative: " + major + "." + minor + "." + patch);
        }
    }

    /**
     * Parses a {@code major.minor.patch} string.
     *
     * @param text version text, e.g. {@code "1.0.0"}
     * @return parsed version
     * @throws IllegalArgumentException if the text is not a version triple
     */
    public static SemanticVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("version must not be null");
        }
        Matcher matcher = VERSION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("not a major.minor.patch version: '" + text + "'");
        }
        try {
            return new SemanticVersion(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("version component out of range: '" + text + "'", e);
        }
    }

    @Override
    public int compareTo(SemanticVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
