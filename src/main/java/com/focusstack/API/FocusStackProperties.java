package com.focusstack.API;

import com.focusstack.focusStacking.StackOptions;
import com.focusstack.focusStacking.alignment.AlignmentMethod;
import com.focusstack.focusStacking.compositor.BlendMode;
import com.focusstack.focusStacking.sharpness.SharpnessMetric;
import com.focusstack.imageIO.OutputFormat;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Cấu hình mặc định cho mỗi lần stack, đọc từ application.properties (prefix "focusstack").
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "focusstack")
public class FocusStackProperties {
    private String alignmentMethod = "ecc";
    private String sharpnessMetric = "laplacian";
    private int kernelSize = 5;
    private String blendMode = "feathered";
    private String outputFormat = "png";
    private double downscaleFactor = 1.0;
    private boolean parallel = true;
    private int workerThreads = 0;

    // Thư mục lưu ảnh input: uploads/
    private String uploadDir = "src/main/resources/uploads";
    // Thư mục lưu ảnh kết quả: stack/
    private String outputDir = "src/main/resources/stack";
    // Để trống thì không ghi heatmap
    private String debugDir = "";
    private String publicUrl = "/stack/";

    public Path uploadPath() {
        return Paths.get(uploadDir);
    }

    public Path outputPath() {
        return Paths.get(outputDir);
    }

    public StackOptions toOptions() {
        return StackOptions.builder()
                .alignmentMethod(AlignmentMethod.fromValue(alignmentMethod))
                .sharpnessMetric(SharpnessMetric.fromValue(sharpnessMetric))
                .kernelSize(kernelSize)
                .blendMode(BlendMode.fromValue(blendMode))
                .outputFormat(OutputFormat.fromValue(outputFormat))
                .downscaleFactor(downscaleFactor)
                .parallel(parallel)
                .workerThreads(workerThreads)
                .debugDir(debugDir == null || debugDir.isBlank() ? null : Paths.get(debugDir))
                .build();
    }
}
