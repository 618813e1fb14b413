package com.focusstack.API;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Kết quả một lần stack: URL ảnh và số frame thực sự được dùng (ảnh không đọc được bị bỏ qua).
 */
@Getter
@ToString
@AllArgsConstructor
public class StackResult {
    private final String imageUrl;
    private final int frames;
}
