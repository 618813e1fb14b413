package com.focusstack.focusStacking.compositor;

import com.focusstack.focusStacking.AlignedFrame;
import com.focusstack.focusStacking.sharpness.SharpnessMap;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.Indexer;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

/**
 * Ghép N frame đã căn chỉnh thành một ảnh, chọn theo từng pixel dựa trên bản đồ độ nét.
 *
 * <p>Mỗi pixel chỉ phụ thuộc vào chính vị trí đó trên N frame, nên có thể chia ảnh thành các
 * hàng độc lập và xử lý song song ({@code parallel = true}).</p>
 */
public class FocusCompositor {
    private static final Logger logger = LoggerFactory.getLogger(FocusCompositor.class);

    private static final int CHANNELS = 3;

    private final boolean parallel;

    public FocusCompositor() {
        this(false);
    }

    public FocusCompositor(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * @throws IllegalArgumentException nếu danh sách rỗng, lệch số lượng hoặc lệch kích thước
     */
    public Mat composite(List<AlignedFrame> frames, List<SharpnessMap> maps, BlendMode mode) {
        checkInputs(frames, maps);
        if (mode == null) {
            throw new IllegalArgumentException("Blend mode must not be null");
        }

        // Stack 1 ảnh: kết quả chính là ảnh đó
        if (frames.size() == 1) {
            return frames.get(0).getImage().clone();
        }

        int rows = frames.get(0).height();
        int cols = frames.get(0).width();
        logger.debug("Compositing {} frames ({}x{}) in {} mode", frames.size(), cols, rows, mode.value());

        switch (mode) {
            case HARD:
                return hardBlend(frames, maps, rows, cols);
            case FEATHERED:
                return featheredBlend(frames, maps, rows, cols);
            default:
                throw new IllegalArgumentException("Unsupported blend mode: " + mode);
        }
    }

    /**
     * Mỗi pixel copy nguyên từ frame có độ nét lớn nhất; hòa thì lấy frame có index nhỏ nhất.
     */
    private Mat hardBlend(List<AlignedFrame> frames, List<SharpnessMap> maps, int rows, int cols) {
        int n = frames.size();
        Mat result = new Mat(rows, cols, CV_8UC3);
        UByteIndexer[] src = imageIndexers(frames);
        DoubleIndexer[] sharp = scoreIndexers(maps);

        try (UByteIndexer dst = result.createIndexer()) {
            forEachRow(rows, y -> {
                for (int x = 0; x < cols; x++) {
                    int best = 0;
                    double bestScore = sharp[0].get(y, x);
                    for (int i = 1; i < n; i++) {
                        double s = sharp[i].get(y, x);
                        if (s > bestScore) {
                            best = i;
                            bestScore = s;
                        }
                    }
                    for (int c = 0; c < CHANNELS; c++) {
                        dst.put(y, x, c, src[best].get(y, x, c));
                    }
                }
            });
        } finally {
            release(src);
            release(sharp);
        }
        return result;
    }

    /**
     * weight_i = s_i / sum(s). Tổng bằng 0 (vùng phẳng) được coi là 1, nên mọi weight = 0 và pixel ra = 0.
     */
    private Mat featheredBlend(List<AlignedFrame> frames, List<SharpnessMap> maps, int rows, int cols) {
        int n = frames.size();
        Mat result = new Mat(rows, cols, CV_8UC3);
        UByteIndexer[] src = imageIndexers(frames);
        DoubleIndexer[] sharp = scoreIndexers(maps);

        try (UByteIndexer dst = result.createIndexer()) {
            forEachRow(rows, y -> {
                double[] acc = new double[CHANNELS];
                for (int x = 0; x < cols; x++) {
                    double sum = 0;
                    for (int i = 0; i < n; i++) sum += sharp[i].get(y, x);
                    if (sum == 0) sum = 1;

                    acc[0] = acc[1] = acc[2] = 0;
                    for (int i = 0; i < n; i++) {
                        double w = sharp[i].get(y, x) / sum;
                        if (w == 0) continue;
                        for (int c = 0; c < CHANNELS; c++) {
                            acc[c] += w * src[i].get(y, x, c);
                        }
                    }
                    for (int c = 0; c < CHANNELS; c++) {
                        dst.put(y, x, c, saturate(acc[c]));
                    }
                }
            });
        } finally {
            release(src);
            release(sharp);
        }
        return result;
    }

    // chặn trong [0, 255] rồi bỏ phần thập phân
    static int saturate(double v) {
        if (v <= 0) return 0;
        if (v >= 255) return 255;
        return (int) v;
    }

    private void forEachRow(int rows, IntConsumer rowTask) {
        IntStream range = IntStream.range(0, rows);
        if (parallel) range = range.parallel();
        range.forEach(rowTask);
    }

    private static void checkInputs(List<AlignedFrame> frames, List<SharpnessMap> maps) {
        if (frames == null || maps == null || frames.isEmpty() || maps.isEmpty()) {
            throw new IllegalArgumentException("Aligned frames and sharpness maps are required for compositing");
        }
        if (frames.size() != maps.size()) {
            throw new IllegalArgumentException("Got " + frames.size() + " aligned frames but "
                    + maps.size() + " sharpness maps");
        }
        int rows = frames.get(0).height();
        int cols = frames.get(0).width();
        for (int i = 0; i < frames.size(); i++) {
            AlignedFrame f = frames.get(i);
            SharpnessMap m = maps.get(i);
            if (f.getImage().type() != CV_8UC3) {
                throw new IllegalArgumentException("Aligned frame " + i + " is not a 3-channel 8-bit image");
            }
            if (f.height() != rows || f.width() != cols) {
                throw new IllegalArgumentException(String.format("Aligned frame %d is %dx%d, expected %dx%d",
                        i, f.width(), f.height(), cols, rows));
            }
            if (m.height() != rows || m.width() != cols) {
                throw new IllegalArgumentException(String.format("Sharpness map %d is %dx%d, frame is %dx%d",
                        i, m.width(), m.height(), cols, rows));
            }
        }
    }

    private static UByteIndexer[] imageIndexers(List<AlignedFrame> frames) {
        UByteIndexer[] out = new UByteIndexer[frames.size()];
        for (int i = 0; i < out.length; i++) out[i] = frames.get(i).getImage().createIndexer();
        return out;
    }

    private static DoubleIndexer[] scoreIndexers(List<SharpnessMap> maps) {
        DoubleIndexer[] out = new DoubleIndexer[maps.size()];
        for (int i = 0; i < out.length; i++) out[i] = maps.get(i).getScores().createIndexer();
        return out;
    }

    private static void release(Indexer[] indexers) {
        for (Indexer idx : indexers) idx.release();
    }
}
