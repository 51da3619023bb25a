package com.panorama.API;

import com.panorama.config.StitchingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

@Slf4j
@Service
public class ImageStorageService {

	private final Path uploadsPath;

	public ImageStorageService(StitchingProperties properties) {
		this.uploadsPath = Paths.get(properties.getStorage().getUploadDir());
	}

	/**
	 * Removes every file left from the previous upload batch.
	 */
	public void clearUploadsDirectory() throws IOException {
		if (!Files.exists(uploadsPath)) {
			return;
		}

		List<Path> stale;
		try (Stream<Path> files = Files.list(uploadsPath)) {
			stale = files.filter(Files::isRegularFile).toList();
		}
		for (Path file : stale) {
			Files.delete(file);
			log.debug("Deleted {}", file.getFileName());
		}
		log.info("Cleared {} old uploads", stale.size());
	}

	/**
	 * Stores the uploaded images and returns their paths ordered by file name, which is the
	 * order the panorama is stitched in.
	 */
	public List<Path> storeMultiple(List<MultipartFile> files) throws IOException {
		Optional<String> duplicate = findDuplicateName(files);
		if (duplicate.isPresent()) {
			throw new IllegalArgumentException("Duplicate file name: " + duplicate.get());
		}
		clearUploadsDirectory();
		createDirectoryIfNotExists(uploadsPath);

		List<Path> savedPaths = new ArrayList<>();

		for (MultipartFile file : files) {
			String filename = storedName(file);
			if (filename == null) {
				filename = "image_" + System.currentTimeMillis() + "_" + savedPaths.size() + ".jpg";
			}

			Path targetPath = uploadsPath.resolve(filename);
			try (InputStream in = file.getInputStream()) {
				Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
			}
			savedPaths.add(targetPath);
		}

		savedPaths.sort(Comparator.comparing(p -> p.getFileName().toString()));
		return savedPaths;
	}

	/**
	 * First file name that two uploads share once client side directories are stripped.
	 * Such uploads would overwrite each other in the upload directory.
	 */
	public Optional<String> findDuplicateName(List<MultipartFile> files) {
		Set<String> seen = new HashSet<>();
		for (MultipartFile file : files) {
			String name = storedName(file);
			if (name != null && !seen.add(name)) {
				return Optional.of(name);
			}
		}
		return Optional.empty();
	}

	/**
	 * Checks that an upload claims to be an image and has an image extension.
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|tif|tiff|webp)$");
	}

	/** Base name of the upload without client side directories, or null when it has none. */
	private static String storedName(MultipartFile file) {
		String filename = file.getOriginalFilename();
		if (filename == null || filename.isEmpty()) return null;
		Path name = Paths.get(filename).getFileName();
		return name == null ? null : name.toString();
	}

	private void createDirectoryIfNotExists(Path path) throws IOException {
		if (!Files.exists(path)) {
			Files.createDirectories(path);
		}
	}

	public Path getUploadsPath() {
		return uploadsPath;
	}
}
