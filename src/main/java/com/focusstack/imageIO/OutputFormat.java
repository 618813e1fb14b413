package com.focusstack.imageIO;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

import static org.bytedeco.opencv.global.opencv_imgcodecs.IMWRITE_JPEG_QUALITY;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMWRITE_PNG_COMPRESSION;

public enum OutputFormat {
    // nén mất dữ liệu
    JPEG(new String[]{"jpg", "jpeg"}, new int[]{IMWRITE_JPEG_QUALITY, 95}),
    // nén không mất dữ liệu
    PNG(new String[]{"png"}, new int[]{IMWRITE_PNG_COMPRESSION, 9}),
    // raster không nén
    TIFF(new String[]{"tiff", "tif"}, new int[0]);

    private final String[] extensions;
    private final int[] writeParams;

    OutputFormat(String[] extensions, int[] writeParams) {
        this.extensions = extensions;
        this.writeParams = writeParams;
    }

    public String defaultExtension() {
        return extensions[0];
    }

    public int[] writeParams() {
        return writeParams.clone();
    }

    /**
     * Thêm đuôi mặc định nếu tên file chưa có đuôi hợp lệ cho định dạng này.
     */
    public Path withExtension(Path destination) {
        String name = destination.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (name.endsWith("." + ext)) return destination;
        }
        return destination.resolveSibling(destination.getFileName() + "." + defaultExtension());
    }

    public static OutputFormat fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (OutputFormat f : values()) {
                if (Arrays.asList(f.extensions).contains(v)) return f;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + value
                + " (expected one of jpg, jpeg, png, tif, tiff)");
    }
}
