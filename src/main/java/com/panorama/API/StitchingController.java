package com.panorama.API;

import com.panorama.exception.StitchingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StitchingController {

    private final StitchingService stitchingService;
    private final ImageStorageService imageStorageService;

    public StitchingController(StitchingService stitchingService, ImageStorageService imageStorageService) {
        this.stitchingService = stitchingService;
        this.imageStorageService = imageStorageService;
    }

    @PostMapping(value = "/stitch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> stitchImages(
            @RequestParam(value = "images", required = false) List<MultipartFile> images,
            @RequestParam(value = "skipUnaligned", defaultValue = "false") boolean skipUnaligned) {
        try {
            if (images == null || images.isEmpty()) {
                return error(HttpStatus.BAD_REQUEST, "Please select at least one image.", null);
            }

            for (MultipartFile image : images) {
                if (!imageStorageService.isValidImageFile(image)) {
                    return error(HttpStatus.BAD_REQUEST, "Invalid image file: " + image.getOriginalFilename(), null);
                }
            }

            Optional<String> duplicate = imageStorageService.findDuplicateName(images);
            if (duplicate.isPresent()) {
                return error(HttpStatus.BAD_REQUEST, "Duplicate file name: " + duplicate.get(), null);
            }

            List<Path> stored = imageStorageService.storeMultiple(images);
            StitchingService.StitchedImage result = stitchingService.stitchImages(stored, skipUnaligned);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("imageUrl", result.getImageUrl());
            response.put("images", result.getImagesUsed());
            response.put("width", result.getWidth());
            response.put("height", result.getHeight());
            response.put("pairs", result.getPairs());
            response.put("message", "Stitched " + result.getImagesUsed() + " of " + images.size() + " images.");

            return ResponseEntity.ok().body(response);

        } catch (StitchingException e) {
            log.warn("Stitching failed ({}): {}", e.kind(), e.getMessage());
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e.kind());
        } catch (Exception e) {
            log.error("Unexpected stitching error", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage(), null);
        }
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String kind) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        if (kind != null) error.put("kind", kind);
        return ResponseEntity.status(status).body(error);
    }
}
