package com.focusstack.focusStacking.alignment;

import java.util.Arrays;
import java.util.Locale;

public enum AlignmentMethod {
    NONE("none"),
    // Enhanced Correlation Coefficient, chỉ tịnh tiến
    CORRELATION("ecc", "correlation"),
    // ORB + FLANN LSH + homography RANSAC
    FEATURE("orb", "feature");

    private final String[] names;

    AlignmentMethod(String... names) {
        this.names = names;
    }

    public String value() {
        return names[0];
    }

    public static AlignmentMethod fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (AlignmentMethod m : values()) {
                if (Arrays.asList(m.names).contains(v)) return m;
            }
        }
        throw new IllegalArgumentException("Unsupported alignment method: " + value
                + " (expected one of none, ecc, correlation, orb, feature)");
    }
}
