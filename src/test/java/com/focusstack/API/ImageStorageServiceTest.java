package com.focusstack.API;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageStorageServiceTest {

    @TempDir
    Path dir;

    private ImageStorageService storage;

    @BeforeEach
    void setUp() {
        FocusStackProperties properties = new FocusStackProperties();
        properties.setUploadDir(dir.resolve("uploads").toString());
        storage = new ImageStorageService(properties);
    }

    @Test
    void storesFilesInUploadOrder() throws IOException {
        List<MultipartFile> files = Arrays.asList(
                new MockMultipartFile("images", "z.jpg", "image/jpeg", new byte[]{1}),
                new MockMultipartFile("images", "a.jpg", "image/jpeg", new byte[]{2}),
                new MockMultipartFile("images", "a.jpg", "image/jpeg", new byte[]{3}));

        List<Path> stored = storage.storeMultiple(files);

        assertThat(stored).extracting(p -> p.getFileName().toString())
                .containsExactly("000_z.jpg", "001_a.jpg", "002_a.jpg");
        assertThat(Files.readAllBytes(stored.get(2))).containsExactly(3);
        assertThat(stored.get(0).getParent().getParent()).isEqualTo(storage.getUploadsPath());
    }

    @Test
    void directoryPartOfUploadNameIsDropped() throws IOException {
        List<Path> stored = storage.storeMultiple(Arrays.asList(
                new MockMultipartFile("images", "../../evil.png", "image/png", new byte[]{1})));

        assertThat(stored.get(0).getFileName().toString()).isEqualTo("000_evil.png");
        assertThat(stored.get(0).startsWith(storage.getUploadsPath())).isTrue();
    }

    @Test
    void deleteRunRemovesRequestDirectory() throws IOException {
        List<Path> stored = storage.storeMultiple(Arrays.asList(
                new MockMultipartFile("images", "a.png", "image/png", new byte[]{1})));
        Path runDir = stored.get(0).getParent();

        storage.deleteRun(stored);

        assertThat(Files.exists(runDir)).isFalse();
        assertThat(Files.exists(storage.getUploadsPath())).isTrue();
    }

    @Test
    void deleteRunLeavesFilesOutsideUploadDirectory() throws IOException {
        Path outside = Files.createDirectories(dir.resolve("other"));
        Path file = Files.write(outside.resolve("keep.png"), new byte[]{1});

        storage.deleteRun(Arrays.asList(file));
        storage.deleteRun(null);

        assertThat(Files.exists(file)).isTrue();
    }

    @Test
    void validatesImageUploads() {
        assertThat(storage.isValidImageFile(new MockMultipartFile("images", "a.JPG", "image/jpeg", new byte[]{1}))).isTrue();
        assertThat(storage.isValidImageFile(new MockMultipartFile("images", "a.tiff", "image/tiff", new byte[]{1}))).isTrue();
        assertThat(storage.isValidImageFile(new MockMultipartFile("images", "a.png", "image/png", new byte[0]))).isFalse();
        assertThat(storage.isValidImageFile(new MockMultipartFile("images", "a.txt", "image/png", new byte[]{1}))).isFalse();
        assertThat(storage.isValidImageFile(new MockMultipartFile("images", "a.png", "text/plain", new byte[]{1}))).isFalse();
        assertThat(storage.isValidImageFile(null)).isFalse();
    }
}
