package com.focusstack.imageIO;

import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Nguồn ảnh: trả về ảnh BGR 8 bit 3 kênh đã decode, hoặc rỗng nếu không đọc được.
 */
@FunctionalInterface
public interface ImageSource {
    Optional<Mat> read(Path path);
}
