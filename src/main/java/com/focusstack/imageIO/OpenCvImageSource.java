package com.focusstack.imageIO;

import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;

/**
 * Đọc ảnh bằng imread. IMREAD_COLOR luôn trả về BGR 3 kênh, kể cả ảnh xám hay có alpha.
 */
public class OpenCvImageSource implements ImageSource {
    private static final Logger logger = LoggerFactory.getLogger(OpenCvImageSource.class);

    @Override
    public Optional<Mat> read(Path path) {
        if (!Files.isRegularFile(path)) {
            logger.debug("Image file not found: {}", path);
            return Optional.empty();
        }
        try {
            Mat img = imread(path.toAbsolutePath().toString(), IMREAD_COLOR);
            if (img == null || img.empty()) {
                logger.debug("imread returned an empty image for {}", path);
                return Optional.empty();
            }
            logger.debug("Loaded {}, shape: {}x{}x{}", path, img.rows(), img.cols(), img.channels());
            return Optional.of(img);
        } catch (RuntimeException e) {
            logger.warn("Error loading {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
