package com.di.compliance.registry;

import com.di.compliance.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Streams a document through a message digest in bounded chunks; the document is never held in memory.
 */
@Component
@RequiredArgsConstructor
public class ChecksumCalculator {

    private final IngestionProperties properties;

    public ContentDigest digest(InputStream in) throws IOException {
        MessageDigest digest = newDigest(properties.getChecksum().getAlgorithm());
        byte[] buffer = new byte[Math.max(1024, properties.getChecksum().getBufferSize())];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
            total += read;
        }
        return new ContentDigest(HexFormat.of().formatHex(digest.digest()), total);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }
}
