package com.focusstack.imageIO;

import org.bytedeco.opencv.opencv_core.Mat;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface ImageSink {
    /**
     * @return đường dẫn thực sự đã ghi (có thể đã thêm đuôi file)
     */
    Path write(Mat image, Path destination, OutputFormat format) throws IOException;
}
