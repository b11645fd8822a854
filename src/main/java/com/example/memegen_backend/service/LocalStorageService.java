package com.example.memegen_backend.service;

import com.example.memegen_backend.exception.StorageException;
import com.example.memegen_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path templatesDir;
    private final Path customDir;
    private final Path outDir;

    public LocalStorageService(Path baseDir, String templatesPrefix, String customPrefix, String outPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.templatesDir = this.baseDir.resolve(templatesPrefix).normalize();
        this.customDir = this.baseDir.resolve(customPrefix).normalize();
        this.outDir = this.baseDir.resolve(outPrefix).normalize();

        try {
            Files.createDirectories(templatesDir);
            Files.createDirectories(customDir);
            Files.createDirectories(outDir);
            LOGGER.info("LocalStorageService ready. base={}, templates={}, custom={}, out={}",
                    this.baseDir, this.templatesDir, this.customDir, this.outDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override public Path rootTemplates() { return templatesDir; }
    @Override public Path rootOut() { return outDir; }

    @Override
    public Path resolveTemplate(String objectKey) {
        return safeResolve(templatesDir, objectKey);
    }

    @Override
    public Path resolveCustom(String objectKey) {
        return safeResolve(customDir, objectKey);
    }

    @Override
    public Path resolveOut(String objectKey) {
        return safeResolve(outDir, objectKey);
    }

    @Override
    public boolean existsInOut(String objectKey) {
        return Files.exists(safeResolve(outDir, objectKey));
    }

    @Override
    public void uploadToOut(Path sourceFile, String objectKey) {
        Path target = safeResolve(outDir, objectKey);
        try {
            Files.createDirectories(target.getParent());
            try {
                Files.move(sourceFile, target, REPLACE_EXISTING, ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException atomicUnsupported) {
                Files.move(sourceFile, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Move failed to " + target, e);
        }
    }

    private Path safeResolve(Path root, String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        // Force forward slashes; strip leading slashes
        String normalizedKey = objectKey.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalizedKey).normalize();
        if (!p.startsWith(root)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }
}
