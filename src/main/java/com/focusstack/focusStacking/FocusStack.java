package com.focusstack.focusStacking;

import com.focusstack.focusStacking.compositor.BlendMode;
import com.focusstack.focusStacking.sharpness.SharpnessMap;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dữ liệu làm việc của một lần chạy: frame gốc, frame đã căn chỉnh, bản đồ độ nét
 * (cùng index) và ảnh kết quả.
 *
 * <p>Kết quả của mỗi bước được ghi vào mảng slot đã cấp phát sẵn theo index frame,
 * mỗi worker chỉ ghi vào slot của mình nên không cần khóa. Bước sau chỉ đọc được
 * dữ liệu của bước trước khi mọi slot đã được điền.</p>
 */
public class FocusStack {
    private final List<Frame> frames = new ArrayList<>();
    private AlignedFrame[] alignedSlots;
    private SharpnessMap[] sharpnessSlots;

    @Getter
    private final BlendMode blendMode;
    @Getter
    private Mat composite;

    public FocusStack(BlendMode blendMode) {
        this.blendMode = blendMode;
    }

    void addFrame(Frame frame) {
        frames.add(frame);
    }

    public List<Frame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public int size() {
        return frames.size();
    }

    void allocateAlignedSlots() {
        alignedSlots = new AlignedFrame[frames.size()];
    }

    void putAligned(int index, AlignedFrame frame) {
        alignedSlots[index] = frame;
    }

    void allocateSharpnessSlots() {
        sharpnessSlots = new SharpnessMap[frames.size()];
    }

    void putSharpness(int index, SharpnessMap map) {
        sharpnessSlots[index] = map;
    }

    void setComposite(Mat composite) {
        this.composite = composite;
    }

    public boolean isAlignmentComplete() {
        return isComplete(alignedSlots);
    }

    public boolean isSharpnessComplete() {
        return isComplete(sharpnessSlots);
    }

    /**
     * @throws IllegalStateException nếu bước căn chỉnh chưa xong hết
     */
    public List<AlignedFrame> getAlignedFrames() {
        if (!isAlignmentComplete()) {
            throw new IllegalStateException("Aligned frames are missing. Run align() first.");
        }
        return Collections.unmodifiableList(Arrays.asList(alignedSlots));
    }

    /**
     * @throws IllegalStateException nếu bước tính độ nét chưa xong hết
     */
    public List<SharpnessMap> getSharpnessMaps() {
        if (!isSharpnessComplete()) {
            throw new IllegalStateException("Sharpness maps are missing. Run computeSharpnessMaps() first.");
        }
        return Collections.unmodifiableList(Arrays.asList(sharpnessSlots));
    }

    /**
     * Giải phóng bộ nhớ native sau khi đã lưu kết quả.
     */
    void discard() {
        for (Frame f : frames) f.getImage().release();
        if (alignedSlots != null) {
            for (AlignedFrame a : alignedSlots) {
                if (a != null) a.getImage().release();
            }
        }
        if (sharpnessSlots != null) {
            for (SharpnessMap m : sharpnessSlots) {
                if (m != null) m.getScores().release();
            }
        }
        if (composite != null) composite.release();
        frames.clear();
        alignedSlots = null;
        sharpnessSlots = null;
        composite = null;
    }

    private static boolean isComplete(Object[] slots) {
        if (slots == null || slots.length == 0) return false;
        for (Object o : slots) {
            if (o == null) return false;
        }
        return true;
    }
}
