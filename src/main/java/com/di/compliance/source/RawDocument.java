package com.di.compliance.source;

import com.di.compliance.model.SourceKind;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A document as handed over by the source layer: bytes plus filename and declared kind.
 *
 * @param filename    name used for classification and in messages
 * @param sourceKind  declared kind; selects the extractor
 * @param storagePath where the bytes live ({@code upload://name} for in-memory uploads)
 * @param content     restartable byte source
 */
public record RawDocument(String filename, SourceKind sourceKind, String storagePath, DocumentContent content) {

    public static final String UPLOAD_SCHEME = "upload://";

    public RawDocument {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(storagePath, "storagePath");
        Objects.requireNonNull(content, "content");
    }

    /**
     * A file on disk; the kind is inferred from its extension.
     *
     * @throws IllegalArgumentException when the extension maps to no source kind
     */
    public static RawDocument ofPath(Path path) {
        String name = path.getFileName().toString();
        SourceKind kind = SourceKind.fromFilename(name);
        if (kind == null) {
            throw new IllegalArgumentException("Cannot infer source kind from filename: " + name);
        }
        return ofPath(path, kind);
    }

    public static RawDocument ofPath(Path path, SourceKind kind) {
        Path absolute = path.toAbsolutePath().normalize();
        return new RawDocument(absolute.getFileName().toString(), kind, absolute.toString(),
                () -> Files.newInputStream(absolute));
    }

    /**
     * An upload held in memory.
     */
    public static RawDocument ofBytes(String filename, SourceKind kind, byte[] bytes) {
        byte[] copy = bytes.clone();
        return new RawDocument(filename, kind, UPLOAD_SCHEME + filename, () -> new ByteArrayInputStream(copy));
    }
}
