package com.focusstack.API;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Tham số ghi đè của một request. null = dùng giá trị trong application.properties.
 */
@Getter
@ToString
@AllArgsConstructor
public class StackRequest {
    private final String align;
    private final String sharpness;
    private final Integer kernelSize;
    private final String blend;
    private final String format;
    private final Double downscale;

    public static StackRequest empty() {
        return new StackRequest(null, null, null, null, null, null);
    }
}
