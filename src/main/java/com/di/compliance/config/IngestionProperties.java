package com.di.compliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion settings bound from {@code compliance.ingestion.*}.
 */
@Data
@ConfigurationProperties(prefix = "compliance.ingestion")
public class IngestionProperties {

    /** Folder scanned by the batch runner. */
    private String inboundPath = "./data/raw";

    /** Filename suffixes picked up by the folder scan (case-insensitive). */
    private List<String> extensions = new ArrayList<>(List.of(".csv", ".csv.gz", ".tsv", ".tsv.gz", ".pdf", ".txt"));

    private boolean recursive = true;

    /** Parallel document workers. */
    private int workerCount = 4;

    /** Caller-side limit per document; a document exceeding it is abandoned, not cancelled. */
    private Duration documentTimeout = Duration.ofMinutes(10);

    /** Known checksums skip PARSE/PERSIST instead of re-running rows idempotently. */
    private boolean skipKnownDocuments = false;

    private boolean runOnStartup = false;

    private Checksum checksum = new Checksum();
    private ErrorDigest errorDigest = new ErrorDigest();
    private Unstructured unstructured = new Unstructured();

    @Data
    public static class Checksum {
        private String algorithm = "SHA-256";
        private int bufferSize = 64 * 1024;
    }

    @Data
    public static class ErrorDigest {
        /** Reasons enumerated in the digest; the remainder is only counted. */
        private int maxEntries = 10;
        private int maxLength = 2000;
    }

    @Data
    public static class Unstructured {
        /** Non-blank fields required to accept an extraction, natural key included. */
        private int minimumFields = 3;
        /** Shorter texts are treated as a failed text layer. */
        private int minimumTextLength = 50;
    }
}
