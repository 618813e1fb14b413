package com.focusstack.focusStacking.sharpness;

import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.COLORMAP_JET;
import static org.bytedeco.opencv.global.opencv_imgproc.applyColorMap;

/**
 * Bản đồ độ nét: một giá trị double không âm cho mỗi pixel (CV_64FC1),
 * cùng kích thước với AlignedFrame sinh ra nó. Không sửa sau khi tạo.
 */
@Getter
public class SharpnessMap {
    private final int frameIndex;
    private final Mat scores;

    public SharpnessMap(int frameIndex, Mat scores) {
        if (scores == null || scores.empty() || scores.type() != CV_64FC1) {
            throw new IllegalArgumentException("Sharpness scores must be a non-empty CV_64FC1 matrix");
        }
        this.frameIndex = frameIndex;
        this.scores = scores;
    }

    public int width() {
        return scores.cols();
    }

    public int height() {
        return scores.rows();
    }

    /**
     * Chuẩn hóa min-max về 0..255 và tô màu JET, dùng để debug.
     */
    public Mat toHeatmap() {
        Mat normalized = new Mat();
        normalize(scores, normalized, 0, 255, NORM_MINMAX, CV_8U, new Mat());
        Mat heatmap = new Mat();
        applyColorMap(normalized, heatmap, COLORMAP_JET);
        normalized.release();
        return heatmap;
    }
}
