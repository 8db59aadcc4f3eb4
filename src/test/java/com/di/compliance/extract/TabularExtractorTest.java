package com.di.compliance.extract;

import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.RecordType;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TabularExtractor Tests")
class TabularExtractorTest {

    private final TabularExtractor extractor = new TabularExtractor(new CsvParserFactory(), new CompressionSupport());

    private static RawDocument csv(String filename, String text) {
        return RawDocument.ofBytes(filename, SourceKind.TABULAR, text.getBytes(StandardCharsets.UTF_8));
    }

    private List<ExtractedRow> extractAll(RawDocument document) {
        try (Stream<ExtractedRow> rows = extractor.extract(document)) {
            return rows.toList();
        }
    }

    @Test
    @DisplayName("Should yield one row per data line in file order, typed by filename")
    void testExtract_TypedByFilename() {
        List<ExtractedRow> rows = extractAll(csv("inspections_q1.csv", """
                Inspection ID,Site,Inspection Date,Result
                INS-1,Plant A,2024-01-02,PASS
                INS-2,Plant B,2024-01-03,FAIL
                """));

        assertEquals(2, rows.size());
        assertEquals(1, rows.get(0).position());
        assertEquals(2, rows.get(1).position());
        assertEquals(RecordType.INSPECTION, rows.get(0).recordType());
        assertEquals("INS-1", rows.get(0).get("inspection_id"));
        assertEquals("Plant B", rows.get(1).get("site"));
        assertEquals(List.of("inspection_id", "site", "inspection_date", "result"),
                List.copyOf(rows.get(0).fields().keySet()));
    }

    @Test
    @DisplayName("A record_type column types each row and wins over the filename")
    void testExtract_RecordTypeColumn() {
        List<ExtractedRow> rows = extractAll(csv("inspections_mixed.csv", """
                record_type,inspection_id,ncr_id,site
                inspection,INS-9,,Plant A
                NCR,,NCR-9,Plant A
                invoice,,,Plant A
                """));

        assertEquals(RecordType.INSPECTION, rows.get(0).recordType());
        assertEquals(RecordType.NCR, rows.get(1).recordType());
        assertNull(rows.get(2).recordType());
        assertEquals("NCR-9", rows.get(1).naturalKey());
    }

    @Test
    @DisplayName("Should fail as unclassifiable when neither filename nor column names a type")
    void testExtract_Unclassifiable() {
        ExtractionException e = assertThrows(ExtractionException.class,
            () -> extractor.extract(csv("export.csv", "a,b\n1,2\n")));
        assertEquals(ExtractionException.Reason.UNCLASSIFIABLE, e.getReason());
    }

    @Test
    @DisplayName("Short rows leave the missing fields absent; blank lines are skipped")
    void testExtract_ShortRowsAndBlankLines() {
        List<ExtractedRow> rows = extractAll(csv("maintenance.csv",
                "event_id,site,machine_id,event_date\nWO-1,Plant A\n\nWO-2,Plant B,M-2,2024-02-02\n"));

        assertEquals(2, rows.size());
        assertEquals("Plant A", rows.get(0).get("site"));
        assertNull(rows.get(0).get("machine_id"));
        assertTrue(rows.get(0).fields().containsKey("machine_id"));
        assertEquals(2, rows.get(1).position());
    }

    @Test
    @DisplayName("Should strip a byte order mark and normalize header names")
    void testExtract_BomAndHeaders() {
        List<ExtractedRow> rows = extractAll(csv("ncr_log.csv",
                "\uFEFFNCR ID, Opened-At ,Severity\nNCR-1,2024-01-01,High\n"));

        assertEquals("NCR-1", rows.get(0).get("ncr_id"));
        assertEquals("2024-01-01", rows.get(0).get("opened_at"));
        assertEquals(RecordType.NCR, rows.get(0).recordType());
    }

    @Test
    @DisplayName("Should decode gzip input and use tabs for .tsv")
    void testExtract_GzipTsv() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream gzip = new GzipCompressorOutputStream(bytes)) {
            gzip.write("event_id\tsite\nWO-7\tPlant C\n".getBytes(StandardCharsets.UTF_8));
        }
        RawDocument document = RawDocument.ofBytes("maintenance_log.tsv.gz", SourceKind.TABULAR, bytes.toByteArray());

        List<ExtractedRow> rows = extractAll(document);

        assertEquals(1, rows.size());
        assertEquals("WO-7", rows.get(0).get("event_id"));
        assertEquals("Plant C", rows.get(0).get("site"));
    }

    @Test
    @DisplayName("Gzip content is inflated whatever the name says")
    void testExtract_GzipBytesUnderPlainName() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (OutputStream gzip = new GzipCompressorOutputStream(bytes)) {
            gzip.write("ncr_id,site\nNCR-4,Plant B\n".getBytes(StandardCharsets.UTF_8));
        }
        RawDocument document = RawDocument.ofBytes("ncr_export.csv", SourceKind.TABULAR, bytes.toByteArray());

        List<ExtractedRow> rows = extractAll(document);

        assertEquals(1, rows.size());
        assertEquals("NCR-4", rows.get(0).get("ncr_id"));
    }

    @Test
    @DisplayName("Plain text under a .gz name is read as is")
    void testExtract_PlainBytesUnderGzipName() {
        RawDocument document = RawDocument.ofBytes("inspections.csv.gz", SourceKind.TABULAR,
                "inspection_id,site\nINS-9,Plant A\n".getBytes(StandardCharsets.UTF_8));

        List<ExtractedRow> rows = extractAll(document);

        assertEquals(1, rows.size());
        assertEquals("INS-9", rows.get(0).get("inspection_id"));
        assertEquals(RecordType.INSPECTION, rows.get(0).recordType());
    }

    @Test
    @DisplayName("Malformed UTF-8 is unreadable")
    void testExtract_MalformedBytes() {
        byte[] bytes = {'e', 'v', 'e', 'n', 't', '_', 'i', 'd', '\n', (byte) 0xC3, (byte) 0x28, '\n'};
        RawDocument document = RawDocument.ofBytes("maintenance.csv", SourceKind.TABULAR, bytes);

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractAll(document));
        assertEquals(ExtractionException.Reason.UNREADABLE, e.getReason());
    }

    @Test
    @DisplayName("Re-extracting the same bytes yields the same rows")
    void testExtract_Restartable() {
        RawDocument document = csv("inspections.csv", "inspection_id,site\nINS-1,A\nINS-2,B\n");
        assertEquals(extractAll(document), extractAll(document));
    }

    @Test
    @DisplayName("Header-only file yields no rows")
    void testExtract_HeaderOnly() {
        assertTrue(extractAll(csv("inspections.csv", "inspection_id,site\n")).isEmpty());
    }
}
