package com.di.compliance.registry;

/**
 * Hex checksum of a document together with the number of bytes hashed.
 */
public record ContentDigest(String checksum, long sizeBytes) {
}
