package com.di.compliance.registry;

/**
 * Outcome of {@link DocumentRegistry#register}.
 *
 * @param documentId identity of the document row
 * @param isNew      false when the checksum was already registered (by an earlier run or a concurrent worker)
 */
public record Registration(long documentId, boolean isNew, String checksum, long sizeBytes) {
}
