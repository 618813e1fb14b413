package com.focusstack.focusStacking.alignment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Kết quả căn chỉnh một frame: ảnh đã warp (hoặc ảnh gốc khi fallback) kèm cờ thành công.
 * Căn chỉnh thất bại là chuyện bình thường, không ném exception.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AlignmentResult {
    private final Mat image;
    private final AlignmentTransform transform;
    private final boolean succeeded;
    private final String failureReason;

    public static AlignmentResult success(Mat aligned, AlignmentTransform transform) {
        return new AlignmentResult(aligned, transform, true, null);
    }

    public static AlignmentResult failed(Mat original, String reason) {
        return new AlignmentResult(original, AlignmentTransform.identity(), false, reason);
    }
}
