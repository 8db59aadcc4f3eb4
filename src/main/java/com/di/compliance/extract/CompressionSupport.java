package com.di.compliance.extract;

import com.di.compliance.source.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Opens a tabular document's content, inflating it when the bytes are gzip.
 *
 * <p>The gzip header decides, not the name: gzip bytes under {@code .csv} are inflated and a
 * {@code .gz} name over plain text is read as is. A name that disagrees with the content is logged.
 */
@Slf4j
@Component
public class CompressionSupport {

    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;
    private static final int BUFFER_SIZE = 64 * 1024;

    public InputStream open(RawDocument document) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(document.content().openStream(), BUFFER_SIZE);
        try {
            boolean gzipBytes = startsWithGzipHeader(buffered);
            boolean gzipName = document.filename().toLowerCase(Locale.ROOT).endsWith(".gz");
            if (gzipBytes != gzipName) {
                log.warn("[EXTRACT] file={} named {} but content is {}", document.filename(),
                        gzipName ? "gzip" : "plain", gzipBytes ? "gzip" : "plain");
            }
            // concatenated members are read as one stream
            return gzipBytes ? new GzipCompressorInputStream(buffered, true) : buffered;
        } catch (IOException e) {
            buffered.close();
            throw e;
        }
    }

    static boolean startsWithGzipHeader(BufferedInputStream stream) throws IOException {
        stream.mark(2);
        int first = stream.read();
        int second = stream.read();
        stream.reset();
        return first == GZIP_MAGIC_1 && second == GZIP_MAGIC_2;
    }
}
