package com.focusstack.focusStacking.alignment;

import lombok.Getter;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * Phép biến đổi 3x3 đưa tọa độ của một frame về hệ tọa độ của frame tham chiếu.
 * Translation được lưu ở dạng đồng nhất (hàng cuối = 0 0 1).
 */
public class AlignmentTransform {

    public enum Kind {IDENTITY, TRANSLATION, HOMOGRAPHY}

    private static final AlignmentTransform IDENTITY =
            new AlignmentTransform(Kind.IDENTITY, new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1});

    @Getter
    private final Kind kind;
    private final double[] data; // row-major 3x3, không lộ ra ngoài

    private AlignmentTransform(Kind kind, double[] data) {
        this.kind = kind;
        this.data = data;
    }

    public static AlignmentTransform identity() {
        return IDENTITY;
    }

    public static AlignmentTransform translation(double tx, double ty) {
        return new AlignmentTransform(Kind.TRANSLATION, new double[]{1, 0, tx, 0, 1, ty, 0, 0, 1});
    }

    /**
     * Đọc ma trận homography 3x3 (CV_64F) do findHomography trả về.
     */
    public static AlignmentTransform homography(Mat h) {
        if (h == null || h.empty() || h.rows() != 3 || h.cols() != 3) {
            throw new IllegalArgumentException("Homography must be a non-empty 3x3 matrix");
        }
        Mat h64 = h;
        if (h.type() != CV_64F) {
            h64 = new Mat();
            h.convertTo(h64, CV_64F);
        }
        double[] values = new double[9];
        try (DoubleIndexer idx = h64.createIndexer()) {
            for (int r = 0; r < 3; r++) {
                for (int c = 0; c < 3; c++) {
                    values[r * 3 + c] = idx.get(r, c);
                }
            }
        }
        return new AlignmentTransform(Kind.HOMOGRAPHY, values);
    }

    public boolean isIdentity() {
        return kind == Kind.IDENTITY;
    }

    public double get(int row, int col) {
        return data[row * 3 + col];
    }

    /**
     * Bản sao row-major của ma trận 3x3.
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Chiếu điểm (x, y) qua phép biến đổi. Trả về null nếu điểm rơi ra vô cực.
     */
    public double[] project(double x, double y) {
        double zPrime = data[6] * x + data[7] * y + data[8];
        if (Math.abs(zPrime) < 1e-10) return null;

        double xPrime = (data[0] * x + data[1] * y + data[2]) / zPrime;
        double yPrime = (data[3] * x + data[4] * y + data[5]) / zPrime;
        return new double[]{xPrime, yPrime};
    }

    @Override
    public String toString() {
        return kind + Arrays.toString(data);
    }
}
