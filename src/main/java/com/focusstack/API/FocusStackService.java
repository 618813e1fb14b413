package com.focusstack.API;

import com.focusstack.focusStacking.FocusStackPipeline;
import com.focusstack.focusStacking.StackOptions;
import com.focusstack.focusStacking.alignment.AlignmentMethod;
import com.focusstack.focusStacking.compositor.BlendMode;
import com.focusstack.focusStacking.sharpness.SharpnessMetric;
import com.focusstack.imageIO.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@Service
public class FocusStackService {
    private static final Logger logger = LoggerFactory.getLogger(FocusStackService.class);

    private final FocusStackProperties properties;

    public FocusStackService(FocusStackProperties properties) {
        this.properties = properties;
    }

    /**
     * Gộp cấu hình mặc định với tham số của request.
     *
     * @throws IllegalArgumentException nếu có tham số không hợp lệ
     */
    public StackOptions resolveOptions(StackRequest request) {
        StackOptions.StackOptionsBuilder builder = properties.toOptions().toBuilder();
        if (request.getAlign() != null) builder.alignmentMethod(AlignmentMethod.fromValue(request.getAlign()));
        if (request.getSharpness() != null) builder.sharpnessMetric(SharpnessMetric.fromValue(request.getSharpness()));
        if (request.getKernelSize() != null) builder.kernelSize(request.getKernelSize());
        if (request.getBlend() != null) builder.blendMode(BlendMode.fromValue(request.getBlend()));
        if (request.getFormat() != null) builder.outputFormat(OutputFormat.fromValue(request.getFormat()));
        if (request.getDownscale() != null) builder.downscaleFactor(request.getDownscale());
        return builder.build().validate();
    }

    /**
     * Chạy một pipeline mới trên các ảnh đã lưu. Mỗi request ghi ra một file tên riêng.
     */
    public StackResult stackImages(List<Path> inputs, StackOptions options) {
        logger.info("Stacking {} images with {}", inputs.size(), options);
        String name = "focus_stack_" + UUID.randomUUID();
        FocusStackPipeline pipeline = new FocusStackPipeline(options);
        Path written = pipeline.process(inputs, properties.outputPath().resolve(name));
        return new StackResult(properties.getPublicUrl() + written.getFileName(), pipeline.getFrameCount());
    }
}
