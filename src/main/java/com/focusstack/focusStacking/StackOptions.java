package com.focusstack.focusStacking;

import com.focusstack.focusStacking.alignment.AlignmentMethod;
import com.focusstack.focusStacking.compositor.BlendMode;
import com.focusstack.focusStacking.sharpness.SharpnessMapper;
import com.focusstack.focusStacking.sharpness.SharpnessMetric;
import com.focusstack.imageIO.OutputFormat;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

@Getter
@Builder(toBuilder = true)
@ToString
public class StackOptions {
    @Builder.Default
    private final AlignmentMethod alignmentMethod = AlignmentMethod.CORRELATION;
    @Builder.Default
    private final SharpnessMetric sharpnessMetric = SharpnessMetric.LAPLACIAN;
    @Builder.Default
    private final int kernelSize = 5;
    @Builder.Default
    private final BlendMode blendMode = BlendMode.FEATHERED;
    @Builder.Default
    private final OutputFormat outputFormat = OutputFormat.PNG;
    // 1.0 = giữ nguyên kích thước
    @Builder.Default
    private final double downscaleFactor = 1.0;
    @Builder.Default
    private final boolean parallel = false;
    // 0 = số CPU
    @Builder.Default
    private final int workerThreads = 0;
    // null = không ghi heatmap độ nét
    private final Path debugDir;

    public static StackOptions defaults() {
        return StackOptions.builder().build();
    }

    public int effectiveKernelSize() {
        return SharpnessMapper.effectiveKernelSize(kernelSize);
    }

    public int effectiveWorkers(int tasks) {
        int workers = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(workers, tasks));
    }

    /**
     * @throws IllegalArgumentException nếu có tham số không hợp lệ
     */
    public StackOptions validate() {
        if (alignmentMethod == null || sharpnessMetric == null || blendMode == null || outputFormat == null) {
            throw new IllegalArgumentException("Alignment method, sharpness metric, blend mode and output format are required");
        }
        if (effectiveKernelSize() > SharpnessMapper.MAX_KERNEL_SIZE) {
            throw new IllegalArgumentException("Kernel size must not exceed " + SharpnessMapper.MAX_KERNEL_SIZE
                    + ": " + kernelSize);
        }
        if (!(downscaleFactor > 0) || Double.isInfinite(downscaleFactor)) {
            throw new IllegalArgumentException("Downscale factor must be a positive number: " + downscaleFactor);
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("Worker threads must not be negative: " + workerThreads);
        }
        return this;
    }
}
