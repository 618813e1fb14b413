package com.focusstack.API;

import com.focusstack.focusStacking.FocusStackException;
import com.focusstack.focusStacking.StackOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class FocusStackController {
    private static final Logger logger = LoggerFactory.getLogger(FocusStackController.class);

    @Autowired
    private FocusStackService focusStackService;

    @Autowired
    private ImageStorageService imageStorageService;

    @PostMapping(value = "/stack", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> stackImages(
            @RequestParam("images") List<MultipartFile> images,
            @RequestParam(value = "align", required = false) String align,
            @RequestParam(value = "sharpness", required = false) String sharpness,
            @RequestParam(value = "kernelSize", required = false) Integer kernelSize,
            @RequestParam(value = "blend", required = false) String blend,
            @RequestParam(value = "format", required = false) String format,
            @RequestParam(value = "downscale", required = false) Double downscale) {
        if (images == null || images.isEmpty()) {
            return error(ResponseEntity.badRequest(), "Please select at least one image.");
        }

        // Kiểm tra tất cả file có phải là ảnh hợp lệ
        for (MultipartFile image : images) {
            if (!imageStorageService.isValidImageFile(image)) {
                return error(ResponseEntity.badRequest(), "Invalid image file: " + image.getOriginalFilename());
            }
        }

        StackOptions options;
        try {
            options = focusStackService.resolveOptions(new StackRequest(align, sharpness, kernelSize, blend, format, downscale));
        } catch (IllegalArgumentException e) {
            return error(ResponseEntity.badRequest(), e.getMessage());
        }

        List<Path> stored = null;
        try {
            stored = imageStorageService.storeMultiple(images);
            StackResult result = focusStackService.stackImages(stored, options);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("imageUrl", result.getImageUrl());
            response.put("frames", result.getFrames());
            response.put("message", "Focus stacked " + result.getFrames() + " of " + images.size() + " images.");
            return ResponseEntity.ok().body(response);
        } catch (FocusStackException e) {
            logger.error("Focus stacking failed at {}: {}", e.getStage(), e.getMessage());
            return error(ResponseEntity.internalServerError(), "Error: " + e.getMessage());
        } catch (IOException e) {
            logger.error("Could not store uploaded images", e);
            return error(ResponseEntity.internalServerError(), "Error: " + e.getMessage());
        } finally {
            imageStorageService.deleteRun(stored);
        }
    }

    private static ResponseEntity<Map<String, String>> error(ResponseEntity.BodyBuilder builder, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return builder.body(error);
    }
}
