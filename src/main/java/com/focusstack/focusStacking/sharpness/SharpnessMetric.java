package com.focusstack.focusStacking.sharpness;

import java.util.Locale;

public enum SharpnessMetric {
    // |Laplacian| rồi lấy trung bình cục bộ
    LAPLACIAN("laplacian"),
    // sqrt(gx^2 + gy^2)
    SOBEL("sobel"),
    // gx^2 + gy^2, không lấy căn
    TENENGRAD("tenengrad");

    private final String value;

    SharpnessMetric(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SharpnessMetric fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (SharpnessMetric m : values()) {
                if (m.value.equals(v)) return m;
            }
        }
        throw new IllegalArgumentException("Unsupported sharpness metric: " + value
                + " (expected one of laplacian, sobel, tenengrad)");
    }
}
