package com.smartservice.core.parser;

/**
 * Builds dotted descriptor paths such as
 * {@code data_sources.measurements.Measurements.query.select[2]}.
 */
public final class DescriptorPath {

    public static final String ROOT = "<root>";

    private DescriptorPath() {
        // Utility class
    }

    public static String child(String parent, String key) {
        if (parent == null || parent.isEmpty() || ROOT.equals(parent)) {
            return key;
        }
        return parent + "." + key;
    }

    public static String index(String parent, int index) {
        return parent + "[" + index + "]";
    }
}
