package com.focusstack.focusStacking;

import com.focusstack.focusStacking.alignment.AlignmentTransform;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Frame đã được warp về hệ tọa độ của frame tham chiếu, cùng kích thước với frame tham chiếu.
 * registered = false nghĩa là căn chỉnh thất bại và pixel được giữ nguyên (fallback).
 */
@Getter
@AllArgsConstructor
public class AlignedFrame {
    private final int index;
    private final Mat image;
    private final AlignmentTransform transform;
    private final boolean registered;

    public int width() {
        return image.cols();
    }

    public int height() {
        return image.rows();
    }
}
