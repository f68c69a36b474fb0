package com.colorcorrection.session;

import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Stores uploaded images in the upload folder and registers them in the
 * session together with an encoded preview.
 */
@Service
@Slf4j
public class ImageRegistrationService {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SessionRegistry registry;
    private final ImageCodec codec;
    private final Path uploadFolder;

    public ImageRegistrationService(
            SessionRegistry registry,
            ImageCodec codec,
            @Value("${app.workspace.upload-folder:uploads}") String uploadFolder) {
        this.registry = registry;
        this.codec = codec;
        this.uploadFolder = Paths.get(uploadFolder).toAbsolutePath().normalize();
    }

    /**
     * @throws IOException if the file cannot be stored or is not a readable image
     */
    public ImageDescriptor registerImage(String originalFilename, InputStream content) throws IOException {
        ImageDescriptor image = store(STAMP.format(LocalDateTime.now()) + "_" + sanitize(originalFilename), content);
        registry.addImage(image);
        log.info("Uploaded image: {}", image.filename());
        return image;
    }

    public ImageDescriptor registerWhiteImage(String originalFilename, InputStream content) throws IOException {
        ImageDescriptor image = store(STAMP.format(LocalDateTime.now()) + "_white_" + sanitize(originalFilename), content);
        registry.setWhiteImage(image);
        log.info("Uploaded white image: {}", image.filename());
        return image;
    }

    /**
     * Decodes the registered white reference for flat-field correction.
     *
     * @return the decoded frame, or {@code null} when no white image is
     *         registered or its file can no longer be read
     */
    public ImageFrame loadWhiteReference() {
        ImageDescriptor white = registry.whiteImage().orElse(null);
        if (white == null) {
            log.warn("Flat-field correction enabled but no white image uploaded");
            return null;
        }
        try {
            return codec.read(white.path());
        } catch (IOException | RuntimeException e) {
            log.warn("White image {} unavailable, continuing without it: {}", white.filename(), e.getMessage());
            return null;
        }
    }

    private ImageDescriptor store(String filename, InputStream content) throws IOException {
        Files.createDirectories(uploadFolder);
        Path target = uploadFolder.resolve(filename).normalize();
        if (!target.startsWith(uploadFolder)) {
            throw new IOException("Path traversal detected: " + filename);
        }
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);

        try (ImageFrame frame = codec.read(target)) {
            return new ImageDescriptor(filename, target, codec.encode(frame));
        } catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }
    }

    static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) {
            return "image";
        }
        Path name = Paths.get(filename.replace('\\', '/')).getFileName();
        return name == null ? "image" : name.toString();
    }
}
