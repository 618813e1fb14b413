package com.focusstack.focusStacking.compositor;

import java.util.Locale;

public enum BlendMode {
    // trung bình có trọng số theo độ nét
    FEATHERED("feathered"),
    // lấy nguyên pixel của frame nét nhất
    HARD("hard");

    private final String value;

    BlendMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static BlendMode fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (BlendMode m : values()) {
                if (m.value.equals(v)) return m;
            }
        }
        throw new IllegalArgumentException("Unsupported blend mode: " + value
                + " (expected one of feathered, hard)");
    }
}
