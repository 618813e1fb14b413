package com.focusstack.focusStacking.alignment;

import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.*;
import org.bytedeco.opencv.opencv_features2d.FlannBasedMatcher;
import org.bytedeco.opencv.opencv_features2d.ORB;
import org.bytedeco.opencv.opencv_flann.LshIndexParams;
import org.bytedeco.opencv.opencv_flann.SearchParams;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * ORB detect + FLANN (LSH) knnMatch + Lowe's ratio test.
 * Mỗi lần gọi tạo detector/matcher riêng nên có thể chạy song song trên nhiều frame.
 */
public class FeatureMatcherWrapper {
    public static final float RATIO_THRESHOLD = 0.7f;

    // FLANN_INDEX_LSH: table_number=6, key_size=12, multi_probe_level=1
    private static final int LSH_TABLE_NUMBER = 6;
    private static final int LSH_KEY_SIZE = 12;
    private static final int LSH_MULTI_PROBE_LEVEL = 1;
    public static final int SEARCH_CHECKS = 50;

    public static class Features {
        public final KeyPointVector keypoints;
        public final Mat descriptors;

        public Features(KeyPointVector keypoints, Mat descriptors) {
            this.keypoints = keypoints;
            this.descriptors = descriptors;
        }

        public int size() {
            return descriptors == null || descriptors.empty() ? 0 : descriptors.rows();
        }
    }

    public static class MatchResult {
        public final List<DMatch> goodMatches;
        public final Mat refPoints;   // điểm trên ảnh tham chiếu
        public final Mat framePoints; // điểm tương ứng trên frame cần căn chỉnh

        public MatchResult(List<DMatch> matches, Mat refPoints, Mat framePoints) {
            this.goodMatches = matches;
            this.refPoints = refPoints;
            this.framePoints = framePoints;
        }

        public int size() {
            return goodMatches.size();
        }
    }

    public Features detect(Mat gray) {
        ORB orb = ORB.create();
        KeyPointVector keypoints = new KeyPointVector();
        Mat descriptors = new Mat();
        orb.detectAndCompute(gray, new Mat(), keypoints, descriptors);
        orb.close();
        return new Features(keypoints, descriptors);
    }

    /**
     * Query = ảnh tham chiếu, train = frame. Chỉ giữ match có best < 0.7 * second best.
     */
    public MatchResult match(Features ref, Features frame) {
        FlannBasedMatcher matcher = new FlannBasedMatcher(
                new LshIndexParams(LSH_TABLE_NUMBER, LSH_KEY_SIZE, LSH_MULTI_PROBE_LEVEL),
                new SearchParams(SEARCH_CHECKS, 0, true));

        DMatchVectorVector knnMatches = new DMatchVectorVector();
        matcher.knnMatch(ref.descriptors, frame.descriptors, knnMatches, 2);

        List<DMatch> goodMatches = new ArrayList<>();
        List<Point2f> refPts = new ArrayList<>();
        List<Point2f> framePts = new ArrayList<>();

        long size = knnMatches.size();
        for (long i = 0; i < size; i++) {
            DMatchVector matches = knnMatches.get(i);
            // LSH có thể trả về ít hơn 2 ứng viên
            if (matches.size() < 2) continue;

            DMatch m = matches.get(0);
            DMatch n = matches.get(1);

            if (m.distance() < RATIO_THRESHOLD * n.distance()) {
                goodMatches.add(m);
                Point2f p1 = ref.keypoints.get(m.queryIdx()).pt();
                Point2f p2 = frame.keypoints.get(m.trainIdx()).pt();
                refPts.add(new Point2f(p1.x(), p1.y()));
                framePts.add(new Point2f(p2.x(), p2.y()));
            }
        }
        matcher.close();

        return new MatchResult(goodMatches, listPointToMat(refPts), listPointToMat(framePts));
    }

    private Mat listPointToMat(List<Point2f> points) {
        Mat mat = new Mat(points.size(), 1, CV_32FC2);
        if (points.isEmpty()) return mat;
        FloatPointer ptr = new FloatPointer(mat.data());
        float[] buf = new float[points.size() * 2];
        for (int i = 0; i < points.size(); i++) {
            buf[2 * i] = points.get(i).x();
            buf[2 * i + 1] = points.get(i).y();
        }
        ptr.put(buf);
        return mat;
    }
}
