package com.focusstack.imageIO;

import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

public class OpenCvImageSink implements ImageSink {
    private static final Logger logger = LoggerFactory.getLogger(OpenCvImageSink.class);

    @Override
    public Path write(Mat image, Path destination, OutputFormat format) throws IOException {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("No image to write");
        }
        Path target = format.withExtension(destination.toAbsolutePath());
        Path parent = target.getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        int[] params = format.writeParams();
        boolean ok;
        try {
            if (params.length == 0) {
                ok = imwrite(target.toString(), image);
            } else {
                try (IntPointer p = new IntPointer(params)) {
                    ok = imwrite(target.toString(), image, p);
                }
            }
        } catch (RuntimeException e) {
            throw new IOException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        if (!ok) {
            throw new IOException("OpenCV could not write " + target);
        }
        logger.info("Saved output to {}", target);
        return target;
    }
}
