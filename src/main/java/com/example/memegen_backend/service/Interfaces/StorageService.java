package com.example.memegen_backend.service.Interfaces;

import java.nio.file.Path;

public interface StorageService {
    /** Template catalog directory: one sub-directory per template id. */
    Path rootTemplates();

    /** Rendered images. */
    Path rootOut();

    /** Directory of one template inside the catalog. */
    Path resolveTemplate(String objectKey);

    /** Seeded backgrounds and overlays for custom templates, keyed by URL fingerprint. */
    Path resolveCustom(String objectKey);

    Path resolveOut(String objectKey);

    boolean existsInOut(String objectKey);

    /** Moves a freshly written file into "out", replacing any previous file for the key. */
    void uploadToOut(Path sourceFile, String objectKey);
}
