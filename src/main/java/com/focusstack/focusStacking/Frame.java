package com.focusstack.focusStacking;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Ảnh đầu vào đã decode (BGR, 8 bit, 3 kênh) cùng vị trí của nó trong chuỗi ảnh.
 * Không được sửa pixel sau khi load.
 */
@Getter
@AllArgsConstructor
public class Frame {
    private final int index;
    private final String source;
    private final Mat image;

    public int width() {
        return image.cols();
    }

    public int height() {
        return image.rows();
    }

    @Override
    public String toString() {
        return String.format("Frame[%d] %s (%dx%d)", index, source, width(), height());
    }
}
