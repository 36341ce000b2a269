package com.routeclip.storage;

import com.routeclip.config.MediaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Local video directory. Every generated file name is {@code <random uuid>-<suggested name>}, so two
 * uploads of the same clip never share a path.
 */
@Slf4j
@Service
public class StorageService {

    private final Path baseDir;
    private final String defaultExtension;

    public StorageService(MediaProperties properties) {
        this.baseDir = Paths.get(properties.getVideosDir()).toAbsolutePath().normalize();
        this.defaultExtension = properties.getDefaultExtension();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path ensureBaseDir() throws IOException {
        return Files.createDirectories(baseDir);
    }

    public Path newUploadPath(String suggestedName) {
        return baseDir.resolve(generateFileName(sanitize(suggestedName)));
    }

    /**
     * Path for the transcoder output. Carries an extension so the encoder can infer the container.
     */
    public Path newOutputPath(String suggestedName) {
        String name = sanitize(suggestedName);
        if (!hasExtension(name)) {
            name = name + defaultExtension;
        }
        return baseDir.resolve(generateFileName(name));
    }

    /**
     * Copies the stream to a path that must not exist yet. A partially written file is removed
     * before the error is rethrown.
     */
    public void write(InputStream input, Path target) throws IOException {
        try {
            Files.copy(input, target);
        } catch (IOException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    public void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", path, e.getMessage());
        }
    }

    public Path loadAsPath(String path) {
        return Paths.get(path);
    }

    static String generateFileName(String name) {
        return UUID.randomUUID() + "-" + name;
    }

    static String sanitize(String suggestedName) {
        if (suggestedName == null || suggestedName.isBlank()) {
            return "";
        }
        String normalized = suggestedName.replace('\\', '/');
        String last = normalized.substring(normalized.lastIndexOf('/') + 1).trim();
        if (last.equals(".") || last.equals("..")) {
            return "";
        }
        return last;
    }

    private static boolean hasExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1;
    }
}
