package com.adlanda.perema.service;

import com.adlanda.perema.config.PhotoProperties;
import com.adlanda.perema.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Stores uploaded contact photos on disk.
 *
 * Files are named after the SHA-256 hash of their content, so the same image
 * uploaded twice is stored once and client-supplied file names never touch
 * the filesystem.
 */
@Service
public class PhotoStorageService {

    private static final Logger log = LoggerFactory.getLogger(PhotoStorageService.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/webp", "webp"
    );

    private final PhotoProperties properties;

    public PhotoStorageService(PhotoProperties properties) {
        this.properties = properties;
    }

    /**
     * Writes the photo to the photo directory.
     *
     * @param photo The uploaded file
     * @return Public URL path of the stored photo, e.g. {@code /photos/ab12...ef.jpg}
     * @throws InvalidRequestException If the upload is empty or not a supported image type
     * @throws IOException             If the file cannot be written
     */
    public String store(MultipartFile photo) throws IOException {
        if (photo.isEmpty()) {
            throw new InvalidRequestException("Photo is empty");
        }
        String extension = EXTENSIONS.get(normalizeContentType(photo.getContentType()));
        if (extension == null) {
            throw new InvalidRequestException("Photo must be a JPEG, PNG, GIF or WebP image");
        }

        byte[] content = photo.getBytes();
        String fileName = computeHash(content) + "." + extension;

        Path directory = Path.of(properties.getDirectory());
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName);
        if (Files.exists(target)) {
            log.debug("Photo {} already stored", fileName);
        } else {
            Files.write(target, content);
            log.info("Stored photo {} ({} bytes)", fileName, content.length);
        }
        return properties.getUrlPrefix() + "/" + fileName;
    }

    /**
     * Computes the SHA-256 hash of the given bytes.
     *
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private String normalizeContentType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int parameters = contentType.indexOf(';');
        String type = parameters >= 0 ? contentType.substring(0, parameters) : contentType;
        return type.trim().toLowerCase();
    }
}
