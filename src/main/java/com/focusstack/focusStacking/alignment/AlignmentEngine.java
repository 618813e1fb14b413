package com.focusstack.focusStacking.alignment;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_core.TermCriteria;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_imgproc.*;
import static org.bytedeco.opencv.global.opencv_video.MOTION_TRANSLATION;
import static org.bytedeco.opencv.global.opencv_video.findTransformECC;

/**
 * Căn chỉnh một frame về frame tham chiếu.
 *
 * <p>Không giữ state dùng chung giữa các lần gọi: ảnh tham chiếu chỉ được đọc, nên có thể
 * gọi {@link #align} song song cho nhiều frame. Mọi lỗi của một frame (thiếu feature, ECC không
 * hội tụ, lỗi số học của OpenCV) đều được bắt tại đây, ghi WARN và trả về frame gốc với
 * {@code succeeded = false}.</p>
 */
public class AlignmentEngine {
    private static final Logger logger = LoggerFactory.getLogger(AlignmentEngine.class);

    public static final int ECC_MAX_ITERATIONS = 1000;
    public static final double ECC_EPSILON = 1e-5;
    private static final int ECC_GAUSS_FILTER_SIZE = 5;

    public static final int MIN_DESCRIPTORS = 2;
    // homography cần ít nhất 4 cặp điểm
    public static final int MIN_GOOD_MATCHES = 4;

    private final FeatureMatcherWrapper matcher;

    public AlignmentEngine() {
        this(new FeatureMatcherWrapper());
    }

    public AlignmentEngine(FeatureMatcherWrapper matcher) {
        this.matcher = matcher;
    }

    public AlignmentResult align(Mat reference, Mat frame, AlignmentMethod method) {
        switch (method) {
            case NONE:
                return AlignmentResult.success(frame, AlignmentTransform.identity());
            case CORRELATION:
                return alignCorrelation(reference, frame);
            case FEATURE:
                return alignFeatures(reference, frame);
            default:
                throw new IllegalArgumentException("Unsupported alignment method: " + method);
        }
    }

    private AlignmentResult alignCorrelation(Mat reference, Mat frame) {
        Mat grayRef = toGray(reference);
        Mat grayImg = toGray(frame);
        Mat warpMatrix = Mat.eye(2, 3, CV_32F).asMat();
        TermCriteria criteria = new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS,
                ECC_MAX_ITERATIONS, ECC_EPSILON);

        try {
            double cc = findTransformECC(grayRef, grayImg, warpMatrix, MOTION_TRANSLATION, criteria,
                    new Mat(), ECC_GAUSS_FILTER_SIZE);

            Mat aligned = new Mat();
            warpAffine(frame, aligned, warpMatrix, new Size(reference.cols(), reference.rows()),
                    INTER_LINEAR + WARP_INVERSE_MAP, BORDER_CONSTANT, new Scalar());

            double tx, ty;
            try (FloatIndexer idx = warpMatrix.createIndexer()) {
                tx = idx.get(0, 2);
                ty = idx.get(1, 2);
            }
            logger.debug("ECC converged: cc={} shift=({}, {})", cc, tx, ty);
            // WARP_INVERSE_MAP: warpMatrix đưa tọa độ ref -> frame, nên frame -> ref là dịch ngược lại
            return AlignmentResult.success(aligned, AlignmentTransform.translation(-tx, -ty));
        } catch (RuntimeException e) {
            return fallback(frame, "ECC alignment failed: " + e.getMessage());
        } finally {
            grayRef.release();
            grayImg.release();
        }
    }

    private AlignmentResult alignFeatures(Mat reference, Mat frame) {
        Mat grayRef = toGray(reference);
        Mat grayImg = toGray(frame);

        try {
            FeatureMatcherWrapper.Features refFeatures = matcher.detect(grayRef);
            FeatureMatcherWrapper.Features imgFeatures = matcher.detect(grayImg);
            logger.debug("ORB descriptors: reference={} frame={}", refFeatures.size(), imgFeatures.size());

            if (refFeatures.size() < MIN_DESCRIPTORS || imgFeatures.size() < MIN_DESCRIPTORS) {
                return fallback(frame, "Not enough features found (reference=" + refFeatures.size()
                        + ", frame=" + imgFeatures.size() + ")");
            }

            FeatureMatcherWrapper.MatchResult res = matcher.match(refFeatures, imgFeatures);
            if (res.size() < MIN_GOOD_MATCHES) {
                return fallback(frame, "Not enough good matches (" + res.size() + ")");
            }

            TransformEstimator.Estimate estimate =
                    TransformEstimator.estimateHomography(res.framePoints, res.refPoints);
            if (estimate == null) {
                return fallback(frame, "Homography estimation failed for " + res.size() + " matches");
            }
            logger.debug("Homography from {} good matches, {} inliers", res.size(), estimate.inliers);

            Mat aligned = new Mat();
            warpPerspective(frame, aligned, estimate.homography, new Size(reference.cols(), reference.rows()));
            return AlignmentResult.success(aligned, AlignmentTransform.homography(estimate.homography));
        } catch (RuntimeException e) {
            return fallback(frame, "ORB alignment failed: " + e.getMessage());
        } finally {
            grayRef.release();
            grayImg.release();
        }
    }

    private AlignmentResult fallback(Mat frame, String reason) {
        logger.warn("{}. Using original image.", reason);
        return AlignmentResult.failed(frame, reason);
    }

    static Mat toGray(Mat image) {
        Mat gray = new Mat();
        switch (image.channels()) {
            case 1:
                image.copyTo(gray);
                break;
            case 4:
                cvtColor(image, gray, COLOR_BGRA2GRAY);
                break;
            default:
                cvtColor(image, gray, COLOR_BGR2GRAY);
        }
        return gray;
    }
}
