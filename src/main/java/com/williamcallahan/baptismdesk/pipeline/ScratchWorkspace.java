package com.williamcallahan.baptismdesk.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Local file handling shared by the pipelines: staging uploads, copying helper scripts out of
 * the classpath and removing temporary artifacts.
 */
@Service
public class ScratchWorkspace {

    private static final Logger log = LoggerFactory.getLogger(ScratchWorkspace.class);

    /**
     * Creates a directory and its parents if needed.
     */
    public Path ensureDirectory(Path directory) throws IOException {
        return Files.createDirectories(directory);
    }

    public Path createTempDirectory(String prefix) throws IOException {
        return Files.createTempDirectory(prefix);
    }

    /**
     * Copies an upload stream into a fresh temp file that outlives the HTTP request.
     *
     * @param content upload stream, closed by the caller
     * @param suffix file suffix, e.g. {@code .jpg}
     * @return the staged file
     */
    public Path stage(InputStream content, String suffix) {
        Path staged = null;
        try {
            staged = Files.createTempFile("upload-", suffix);
            Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
            return staged;
        } catch (IOException e) {
            deleteQuietly(staged);
            throw new UncheckedIOException("Failed to stage upload", e);
        }
    }

    /**
     * Copies a classpath resource to {@code target}, writing a sibling temp file first and moving
     * it into place so readers never see a partial file.
     *
     * @param resourcePath classpath location
     * @param target destination file
     */
    public void copyResource(String resourcePath, Path target) throws IOException {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new IOException("Classpath resource not found: " + resourcePath);
        }
        Path partial = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
        try (InputStream in = resource.getInputStream()) {
            Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(partial, target);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    /**
     * Replaces {@code target} with {@code source}, atomically where the filesystem allows.
     */
    public void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes files, logging rather than failing on errors.
     */
    public void deleteQuietly(Path... files) {
        for (Path file : files) {
            if (file == null) {
                continue;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Failed to delete {}: {}", file, e.getMessage());
            }
        }
    }

    /**
     * Deletes a directory tree, logging rather than failing on errors.
     */
    public void deleteRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> deleteQuietly(path));
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", directory, e.getMessage());
        }
    }
}
