package com.project.image.charge.service;

import com.project.image.charge.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Keeps uploaded originals and rendered heatmaps under {@code app.upload.dir}, which
 * StaticResourceConfig serves at /uploads/**.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String filename = stamp() + "_" + sanitize(original);
        Path target = rootDir.resolve(filename);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, filename);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /**
     * Writes a rendered PNG, e.g. {@code 20240101_120000_000_charge.png} for label "charge".
     */
    public StoredFile storeResultImage(byte[] pngBytes, String label) {
        if (pngBytes == null || pngBytes.length == 0) {
            throw new StorageException("Empty result image");
        }
        String filename = stamp() + "_" + sanitize(label == null || label.isBlank() ? "result" : label) + ".png";
        Path target = rootDir.resolve(filename);
        try {
            Files.write(target, pngBytes);
            log.debug("Stored result image {} ({} bytes)", filename, pngBytes.length);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    private static String stamp() {
        return STAMP.format(LocalDateTime.now());
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
