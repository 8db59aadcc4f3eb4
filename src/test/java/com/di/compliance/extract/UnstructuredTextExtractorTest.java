package com.di.compliance.extract;

import com.di.compliance.config.IngestionProperties;
import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.RecordType;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.RawDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UnstructuredTextExtractor Tests")
class UnstructuredTextExtractorTest {

    private static final String NCR_REPORT = """
            NON-CONFORMANCE REPORT
            NCR Number: NCR-2024-017
            Title: Weld porosity on bracket
            Site: Plant A
            Supplier: Acme Metals
            Part Number: PN-4471
            Severity: Major
            Status: Open
            Description: Porosity found in weld seam
            Date Raised: 2024-03-15
            Linked Inspection: INS-2024-001
            """;

    private final IngestionProperties properties = new IngestionProperties();
    private final UnstructuredTextExtractor extractor =
            new UnstructuredTextExtractor(new TextReader(), new DocumentClassifier(), properties);

    private static RawDocument text(String filename, String content) {
        return RawDocument.ofBytes(filename, SourceKind.UNSTRUCTURED, content.getBytes(StandardCharsets.UTF_8));
    }

    private List<ExtractedRow> extractAll(RawDocument document) {
        return extractor.extract(document).toList();
    }

    @Test
    @DisplayName("Should yield exactly one mapping with the labeled fields")
    void testExtract_NcrReport() {
        List<ExtractedRow> rows = extractAll(text("supplier_report.txt", NCR_REPORT));

        assertEquals(1, rows.size());
        ExtractedRow row = rows.get(0);
        assertEquals(1, row.position());
        assertEquals(RecordType.NCR, row.recordType());
        assertEquals("NCR-2024-017", row.get("ncr_id"));
        assertEquals("Plant A", row.get("site"));
        assertEquals("Major", row.get("severity"));
        assertEquals("Open", row.get("status"));
        assertEquals("Porosity found in weld seam", row.get("description"));
        assertEquals("2024-03-15", row.get("opened_at"));
        assertEquals("INS-2024-001", row.get("linked_inspection_id"));
        assertFalse(row.fields().containsKey("closed_at"));
    }

    @Test
    @DisplayName("Natural key falls back to a key-like filename stem")
    void testExtract_KeyFromFilename() {
        List<ExtractedRow> rows = extractAll(text("NCR-2024-099.txt", "Site: Plant B\nSeverity: Minor\n"));

        assertEquals("NCR-2024-099", rows.get(0).get("ncr_id"));
        assertEquals("Plant B", rows.get(0).get("site"));
    }

    @Test
    @DisplayName("No natural key anywhere is low confidence")
    void testExtract_NoKey() {
        ExtractionException e = assertThrows(ExtractionException.class,
            () -> extractor.extract(text("ncr_notes.txt", "Site: Plant A\nSeverity: Minor\nStatus: Open\n")));
        assertEquals(ExtractionException.Reason.LOW_CONFIDENCE, e.getReason());
    }

    @Test
    @DisplayName("Too few fields is low confidence")
    void testExtract_TooFewFields() {
        ExtractionException e = assertThrows(ExtractionException.class,
            () -> extractor.extract(text("NCR-5.txt", "Severity: High\n")));
        assertEquals(ExtractionException.Reason.LOW_CONFIDENCE, e.getReason());
        assertTrue(e.getMessage().contains("only 2 field(s) found"), e.getMessage());
    }

    @Test
    @DisplayName("Threshold is configurable")
    void testExtract_ConfiguredThreshold() {
        properties.getUnstructured().setMinimumFields(2);
        assertEquals(1, extractAll(text("NCR-5.txt", "Severity: High\n")).size());
    }

    @Test
    @DisplayName("Generic text with a generic filename is unclassifiable")
    void testExtract_Unclassifiable() {
        ExtractionException e = assertThrows(ExtractionException.class,
            () -> extractor.extract(text("scan_0001.txt",
                "Minutes of the weekly planning meeting held in the main office on Monday.")));
        assertEquals(ExtractionException.Reason.UNCLASSIFIABLE, e.getReason());
    }

    @Test
    @DisplayName("Almost no text and no filename prefix is low confidence")
    void testExtract_InsufficientText() {
        ExtractionException e = assertThrows(ExtractionException.class,
            () -> extractor.extract(text("scan_0002.txt", "  NCR  ")));
        assertEquals(ExtractionException.Reason.LOW_CONFIDENCE, e.getReason());
    }

    @Test
    @DisplayName("Bytes that are neither PDF nor UTF-8 are unreadable")
    void testExtract_Unreadable() {
        RawDocument document = RawDocument.ofBytes("ncr-1.txt", SourceKind.UNSTRUCTURED,
                new byte[]{(byte) 0xFF, (byte) 0xFE, (byte) 0xC3, (byte) 0x28});
        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(document));
        assertEquals(ExtractionException.Reason.UNREADABLE, e.getReason());
    }

    @Test
    @DisplayName("Should read the text layer of a PDF inspection certificate")
    void testExtract_PdfInspectionCertificate() throws IOException {
        byte[] pdf = pdf(List.of(
                "INSPECTION CERTIFICATE",
                "Inspection ID: INS-2024-001",
                "Site: Plant A",
                "Part Number: PN-100",
                "Inspection Date: 2024-03-15",
                "RESULT: Passed",
                "Measured Value: 2.5 cm"));

        List<ExtractedRow> rows = extractAll(RawDocument.ofBytes("certificate.pdf", SourceKind.UNSTRUCTURED, pdf));

        ExtractedRow row = rows.get(0);
        assertEquals(RecordType.INSPECTION, row.recordType());
        assertEquals("INS-2024-001", row.get("inspection_id"));
        assertEquals("Plant A", row.get("site"));
        assertEquals("2024-03-15", row.get("inspection_date"));
        assertEquals("Passed", row.get("result"));
        assertEquals("2.5", row.get("measurement_value"));
        assertEquals("cm", row.get("measurement_unit"));
    }

    @Test
    @DisplayName("Should read a maintenance work order")
    void testExtract_WorkOrder() {
        List<ExtractedRow> rows = extractAll(text("wo_scan.txt", """
                MAINTENANCE WORK ORDER
                Work Order: WO-2024-118
                Site: Plant C
                Machine ID: PRESS-04
                Event Date: 2024-04-02
                Technician: J. Doe
                Downtime: approx. 3.5 hours
                """));

        ExtractedRow row = rows.get(0);
        assertEquals(RecordType.MAINTENANCE, row.recordType());
        assertEquals("WO-2024-118", row.get("event_id"));
        assertEquals("PRESS-04", row.get("machine_id"));
        assertEquals("3.5", row.get("downtime_hours"));
    }

    @Test
    @DisplayName("Filename stem drops folders and extension")
    void testStem() {
        assertEquals("NCR-1", UnstructuredTextExtractor.stem("in/pdf/NCR-1.pdf"));
        assertEquals("NCR-1", UnstructuredTextExtractor.stem("NCR-1"));
    }

    private static byte[] pdf(List<String> lines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 11);
                content.setLeading(14);
                content.newLineAtOffset(50, 700);
                for (String line : lines) {
                    content.showText(line);
                    content.newLine();
                }
                content.endText();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }
}
