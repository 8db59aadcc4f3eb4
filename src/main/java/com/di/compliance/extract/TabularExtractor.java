package com.di.compliance.extract;

import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.RecordType;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;
import com.di.compliance.validate.RowValidator;
import com.univocity.parsers.csv.CsvParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One field mapping per data row of a delimited file, in file order.
 *
 * <p>Files with a {@code record_type} column are typed per row, which allows mixed batches; otherwise
 * the filename names the type for every row ({@code inspections_q1.csv}). Manual spreadsheets
 * exported as CSV go through the same path.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TabularExtractor implements DocumentExtractor {

    private static final Pattern HEADER_SEPARATORS = Pattern.compile("[\\s\\-]+");
    private static final char BOM = '\uFEFF';

    private final CsvParserFactory parserFactory;
    private final CompressionSupport compressionSupport;

    @Override
    public Set<SourceKind> supportedKinds() {
        return Set.of(SourceKind.TABULAR, SourceKind.MANUAL);
    }

    @Override
    public Stream<ExtractedRow> extract(RawDocument document) {
        String filename = document.filename();
        CsvParser parser = parserFactory.newParser(delimiterFor(filename));
        Reader reader = null;
        try {
            reader = openReader(document);
            parser.beginParsing(reader);
            String[] headerRow = parser.parseNext();
            String[] headers = headerRow == null ? new String[0] : normalizeHeaders(headerRow);
            RecordType fileType = resolveFileType(filename, headers);

            log.info("[EXTRACT] tabular file={} columns={} recordType={}",
                    filename, headers.length, fileType == null ? "per-row" : fileType);

            RowSpliterator rows = new RowSpliterator(parser, headers, fileType, filename);
            Reader toClose = reader;
            return StreamSupport.stream(rows, false).onClose(() -> {
                parser.stopParsing();
                closeQuietly(toClose, filename);
            });
        } catch (ExtractionException e) {
            parser.stopParsing();
            closeQuietly(reader, filename);
            throw e;
        } catch (IOException | RuntimeException e) {
            parser.stopParsing();
            closeQuietly(reader, filename);
            throw new ExtractionException(ExtractionException.Reason.UNREADABLE, filename, rootMessage(e), e);
        }
    }

    private Reader openReader(RawDocument document) throws IOException {
        InputStream content = compressionSupport.open(document);
        return new InputStreamReader(content, StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT));
    }

    /**
     * Type for the whole file, or null when rows carry their own {@code record_type}.
     * A {@code record_type} column takes precedence over the filename.
     */
    private static RecordType resolveFileType(String filename, String[] headers) {
        for (String header : headers) {
            if (RowValidator.RECORD_TYPE_FIELD.equals(header)) {
                return null;
            }
        }
        Optional<RecordType> byName = RecordType.fromFilename(filename);
        if (byName.isPresent()) {
            return byName.get();
        }
        throw new ExtractionException(ExtractionException.Reason.UNCLASSIFIABLE, filename,
                "filename names no record type and there is no record_type column");
    }

    static String[] normalizeHeaders(String[] raw) {
        String[] headers = new String[raw.length];
        for (int i = 0; i < raw.length; i++) {
            String h = raw[i] == null ? "" : raw[i];
            if (i == 0 && !h.isEmpty() && h.charAt(0) == BOM) {
                h = h.substring(1);
            }
            headers[i] = HEADER_SEPARATORS.matcher(h.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        }
        return headers;
    }

    private static char delimiterFor(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".tsv") || lower.endsWith(".tsv.gz") ? '\t' : ',';
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    private static void closeQuietly(Reader reader, String filename) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("[EXTRACT] failed to close file={}: {}", filename, e.getMessage());
        }
    }

    /**
     * Pulls one parsed record per advance; never buffers the file.
     */
    private static final class RowSpliterator extends Spliterators.AbstractSpliterator<ExtractedRow> {

        private final CsvParser parser;
        private final String[] headers;
        private final RecordType fileType;
        private final String filename;
        private int position;

        RowSpliterator(CsvParser parser, String[] headers, RecordType fileType, String filename) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.parser = parser;
            this.headers = headers;
            this.fileType = fileType;
            this.filename = filename;
        }

        @Override
        public boolean tryAdvance(Consumer<? super ExtractedRow> action) {
            String[] cells;
            try {
                cells = parser.parseNext();
            } catch (RuntimeException e) {
                throw new ExtractionException(ExtractionException.Reason.UNREADABLE, filename,
                        String.format("row %d: %s", position + 1, rootMessage(e)), e);
            }
            if (cells == null) {
                return false;
            }
            position++;

            Map<String, String> fields = new LinkedHashMap<>();
            for (int i = 0; i < headers.length; i++) {
                if (headers[i].isEmpty()) {
                    continue;
                }
                fields.put(headers[i], i < cells.length ? cells[i] : null);
            }
            RecordType type = fileType != null
                    ? fileType
                    : RecordType.fromLabel(fields.get(RowValidator.RECORD_TYPE_FIELD)).orElse(null);
            action.accept(new ExtractedRow(position, type, fields));
            return true;
        }
    }
}
