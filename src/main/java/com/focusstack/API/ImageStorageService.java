package com.focusstack.API;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

@Service
public class ImageStorageService {
    private static final Logger logger = LoggerFactory.getLogger(ImageStorageService.class);

    private final Path uploadsPath;

    public ImageStorageService(FocusStackProperties properties) {
        this.uploadsPath = properties.uploadPath();
    }

    /**
     * Lưu ảnh upload vào một thư mục riêng cho request này, giữ đúng thứ tự upload.
     * Trả về danh sách đường dẫn file đã lưu.
     */
    public List<Path> storeMultiple(List<MultipartFile> files) throws IOException {
        Path runDir = uploadsPath.resolve(UUID.randomUUID().toString());
        Files.createDirectories(runDir);

        List<Path> savedPaths = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            String filename = file.getOriginalFilename();
            if (filename == null || filename.isBlank()) {
                filename = "image_" + System.currentTimeMillis() + ".jpg";
            }
            // bỏ phần thư mục trong tên file, thêm số thứ tự để tên không trùng
            filename = Paths.get(filename).getFileName().toString();
            Path targetPath = runDir.resolve(String.format("%03d_%s", i, filename));

            try (InputStream in = file.getInputStream()) {
                Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            savedPaths.add(targetPath);
        }
        logger.debug("Stored {} uploads in {}", savedPaths.size(), runDir);
        return savedPaths;
    }

    /**
     * Xóa thư mục upload của một request sau khi xử lý xong.
     */
    public void deleteRun(List<Path> storedFiles) {
        if (storedFiles == null || storedFiles.isEmpty()) return;
        Path runDir = storedFiles.get(0).getParent();
        if (runDir == null || !runDir.startsWith(uploadsPath)) return;

        try (Stream<Path> walk = Files.walk(runDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.warn("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean upload directory {}: {}", runDir, e.getMessage());
        }
    }

    /**
     * Kiểm tra xem file upload có phải ảnh không
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|tif|tiff|bmp|webp)$");
    }

    public Path getUploadsPath() {
        return uploadsPath;
    }
}
