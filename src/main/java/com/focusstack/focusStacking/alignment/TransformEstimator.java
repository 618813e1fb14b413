package com.focusstack.focusStacking.alignment;

import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_calib3d.RANSAC;
import static org.bytedeco.opencv.global.opencv_calib3d.findHomography;
import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;

public class TransformEstimator {
    public static final double RANSAC_REPROJ_THRESHOLD = 5.0;
    private static final int RANSAC_MAX_ITERS = 2000;
    private static final double RANSAC_CONFIDENCE = 0.995;

    public static class Estimate {
        public final Mat homography;
        public final int inliers;

        Estimate(Mat homography, int inliers) {
            this.homography = homography;
            this.inliers = inliers;
        }
    }

    /**
     * Tính H (3x3) từ điểm của frame (src) sang điểm của ảnh tham chiếu (dst) bằng RANSAC.
     * Trả về null nếu OpenCV không tìm được ma trận hoặc ma trận suy biến.
     */
    public static Estimate estimateHomography(Mat framePoints, Mat refPoints) {
        Mat mask = new Mat();
        Mat h = findHomography(framePoints, refPoints, RANSAC, RANSAC_REPROJ_THRESHOLD, mask,
                RANSAC_MAX_ITERS, RANSAC_CONFIDENCE);

        int inliers = mask.empty() ? 0 : countNonZero(mask);
        mask.release();

        if (!isTransformValid(h)) return null;
        return new Estimate(h, inliers);
    }

    /**
     * Sanity check: ma trận phải hữu hạn và khả nghịch.
     */
    public static boolean isTransformValid(Mat h) {
        if (h == null || h.empty() || h.type() != CV_64F) return false;
        DoublePointer val = new DoublePointer(h.data());

        for (int i = 0; i < 9; i++) {
            if (!Double.isFinite(val.get(i))) return false;
        }
        double det = val.get(0) * (val.get(4) * val.get(8) - val.get(5) * val.get(7))
                - val.get(1) * (val.get(3) * val.get(8) - val.get(5) * val.get(6))
                + val.get(2) * (val.get(3) * val.get(7) - val.get(4) * val.get(6));
        return Math.abs(det) > 1e-12;
    }
}
