package com.focusstack.focusStacking.sharpness;

import com.focusstack.focusStacking.AlignedFrame;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Tính bản đồ độ nét cục bộ cho một frame đã căn chỉnh.
 *
 * <p>Các bước: chuyển sang ảnh xám, áp toán tử đạo hàm (Laplacian hoặc Sobel) với kích thước
 * kernel cho trước, rồi lấy trung bình hộp (box filter) cùng kích thước để có năng lượng cục bộ
 * thay vì nhiễu từng pixel. Không có state, an toàn khi chạy song song.</p>
 */
public class SharpnessMapper {

    // Sobel/Laplacian của OpenCV chỉ nhận aperture lẻ <= 31
    public static final int MAX_KERNEL_SIZE = 31;

    /**
     * Kernel size chẵn được tự động tăng thêm 1.
     */
    public static int effectiveKernelSize(int kernelSize) {
        if (kernelSize < 1) {
            throw new IllegalArgumentException("Kernel size must be positive: " + kernelSize);
        }
        return kernelSize % 2 == 0 ? kernelSize + 1 : kernelSize;
    }

    public SharpnessMap computeMap(AlignedFrame frame, SharpnessMetric metric, int kernelSize) {
        return computeMap(frame.getIndex(), frame.getImage(), metric, kernelSize);
    }

    public SharpnessMap computeMap(int frameIndex, Mat image, SharpnessMetric metric, int kernelSize) {
        int k = effectiveKernelSize(kernelSize);
        if (k > MAX_KERNEL_SIZE) {
            throw new IllegalArgumentException("Kernel size must not exceed " + MAX_KERNEL_SIZE + ": " + kernelSize);
        }
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot compute sharpness of an empty image");
        }

        Mat gray = new Mat();
        if (image.channels() == 1) image.copyTo(gray);
        else if (image.channels() == 4) cvtColor(image, gray, COLOR_BGRA2GRAY);
        else cvtColor(image, gray, COLOR_BGR2GRAY);

        Mat energy;
        switch (metric) {
            case LAPLACIAN:
                energy = laplacianEnergy(gray, k);
                break;
            case SOBEL:
                energy = gradientEnergy(gray, k, true);
                break;
            case TENENGRAD:
                energy = gradientEnergy(gray, k, false);
                break;
            default:
                throw new IllegalArgumentException("Unsupported sharpness metric: " + metric);
        }
        gray.release();

        // Trung bình hộp k x k (tương đương filter2D với kernel ones/k^2)
        Mat scores = new Mat();
        blur(energy, scores, new Size(k, k), new Point(-1, -1), BORDER_DEFAULT);
        energy.release();

        // box filter dạng cộng dồn có thể cho -1e-17, chặn về 0
        threshold(scores, scores, 0, 0, THRESH_TOZERO);
        return new SharpnessMap(frameIndex, scores);
    }

    private Mat laplacianEnergy(Mat gray, int k) {
        Mat lap = new Mat();
        Laplacian(gray, lap, CV_64F, k, 1, 0, BORDER_DEFAULT);
        Mat abs = new Mat();
        absdiff(lap, Mat.zeros(lap.size(), CV_64F).asMat(), abs);
        lap.release();
        return abs;
    }

    private Mat gradientEnergy(Mat gray, int k, boolean takeRoot) {
        Mat gx = new Mat();
        Mat gy = new Mat();
        Sobel(gray, gx, CV_64F, 1, 0, k, 1, 0, BORDER_DEFAULT);
        Sobel(gray, gy, CV_64F, 0, 1, k, 1, 0, BORDER_DEFAULT);

        Mat result = new Mat();
        if (takeRoot) {
            magnitude(gx, gy, result);
        } else {
            Mat gx2 = new Mat();
            Mat gy2 = new Mat();
            multiply(gx, gx, gx2);
            multiply(gy, gy, gy2);
            add(gx2, gy2, result);
            gx2.release();
            gy2.release();
        }
        gx.release();
        gy.release();
        return result;
    }
}
