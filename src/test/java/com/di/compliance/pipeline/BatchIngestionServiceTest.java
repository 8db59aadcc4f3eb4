package com.di.compliance.pipeline;

import com.di.compliance.TestPipeline;
import com.di.compliance.config.IngestionExecutorConfiguration;
import com.di.compliance.config.IngestionProperties;
import com.di.compliance.extract.CompressionSupport;
import com.di.compliance.extract.CsvParserFactory;
import com.di.compliance.extract.DocumentExtractor;
import com.di.compliance.extract.ExtractedRow;
import com.di.compliance.extract.TabularExtractor;
import com.di.compliance.model.ProcessingRun;
import com.di.compliance.model.ProcessingStage;
import com.di.compliance.model.RunStatus;
import com.di.compliance.model.SourceKind;
import com.di.compliance.source.InboundFolderScanner;
import com.di.compliance.source.RawDocument;
import com.di.compliance.util.JsonMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchIngestionService Tests")
class BatchIngestionServiceTest {

    @TempDir
    Path folder;

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private BatchIngestionService service(TestPipeline pipeline) {
        IngestionProperties properties = pipeline.getProperties();
        executor = new IngestionExecutorConfiguration().ingestionExecutor(properties);
        return new BatchIngestionService(pipeline.getOrchestrator(), new InboundFolderScanner(properties),
                executor, pipeline.getRunTracker(), properties);
    }

    private void writeFolder() throws IOException {
        Files.writeString(folder.resolve("inspections_week1.csv"),
                "inspection_id,site,inspection_date,result\n"
                        + "INS-1,Plant A,2024-01-10,PASS\n"
                        + "INS-2,Plant A,2024-01-11,FAIL\n");
        Files.writeString(folder.resolve("maintenance_week1.csv"),
                "event_id,site,machine_id,event_date,downtime_hours\n"
                        + "WO-1,Plant A,CNC-7,2024-01-10,1.5\n"
                        + "WO-2,Plant A,CNC-7,bad-date,2\n");
        Files.writeString(folder.resolve("scan_0001.txt"),
                "Quarterly newsletter for the operations team. Canteen hours change next week.");
        Files.writeString(folder.resolve("notes.md"), "ignored");
    }

    // =========================================================================
    // ingestFolder
    // =========================================================================

    @Test
    @DisplayName("Every matching file is ingested and counted by outcome")
    void testIngestFolder_Summary() throws IOException {
        writeFolder();
        TestPipeline pipeline = TestPipeline.create();

        BatchSummary summary = service(pipeline).ingestFolder(folder);

        assertEquals(3, summary.getDocuments());
        assertEquals(3, summary.getNewDocuments());
        assertEquals(0, summary.getKnownDocuments());
        assertEquals(1, summary.getSucceeded());
        assertEquals(1, summary.getPartial());
        assertEquals(1, summary.getFailed());
        assertEquals(0, summary.getTimedOut());
        assertEquals(4, summary.getRowsAttempted());
        assertEquals(3, summary.getRowsSucceeded());
        assertEquals(1, summary.getRowsFailed());
        assertEquals(3, pipeline.count("documents"));
    }

    @Test
    @DisplayName("Second pass over the same folder finds only known documents")
    void testIngestFolder_Rerun() throws IOException {
        writeFolder();
        TestPipeline pipeline = TestPipeline.create();
        BatchIngestionService service = service(pipeline);

        service.ingestFolder(folder);
        BatchSummary second = service.ingestFolder(folder);

        assertEquals(0, second.getNewDocuments());
        assertEquals(3, second.getKnownDocuments());
        assertEquals(3, pipeline.count("documents"));
        assertEquals(2, pipeline.count("inspections"));
        assertEquals(1, pipeline.count("maintenance_events"));
    }

    @Test
    @DisplayName("Configured folder is used when none is given")
    void testIngestFolder_ConfiguredPath() throws IOException {
        writeFolder();
        TestPipeline pipeline = TestPipeline.create();
        pipeline.getProperties().setInboundPath(folder.toString());

        assertEquals(3, service(pipeline).ingestFolder().getDocuments());
    }

    @Test
    @DisplayName("A file whose kind cannot be inferred counts as failed")
    void testIngestFolder_UnknownKind() throws IOException {
        writeFolder();
        TestPipeline pipeline = TestPipeline.create();
        pipeline.getProperties().setExtensions(List.of(".csv", ".md"));

        BatchSummary summary = service(pipeline).ingestFolder(folder);

        assertEquals(3, summary.getDocuments());
        assertEquals(2, summary.getResults().size());
        assertEquals(1, summary.getFailed());

        List<ProcessingRun> unowned = pipeline.getRuns().findUnownedFailures();
        assertEquals(1, unowned.size());
        ProcessingRun receive = unowned.get(0);
        assertEquals(ProcessingStage.RECEIVE, receive.getStage());
        assertEquals(RunStatus.FAILED, receive.getStatus());
        assertNotNull(receive.getFinishedAt());
        assertTrue(receive.getErrorMessage().contains("notes.md"), receive.getErrorMessage());
        assertEquals("notes.md", JsonMetadata.fromJson(receive.getMetadata()).get("filename"));
    }

    // =========================================================================
    // Timeout
    // =========================================================================

    @Test
    @DisplayName("A stuck document is abandoned without holding up the others")
    void testIngestAll_Timeout() {
        CountDownLatch release = new CountDownLatch(1);
        IngestionProperties properties = new IngestionProperties();
        properties.setDocumentTimeout(Duration.ofMillis(200));
        TestPipeline pipeline = TestPipeline.withExtractors(properties,
                List.of(new BlocksOnSlowFiles(release)));
        BatchIngestionService service = service(pipeline);

        try {
            BatchSummary summary = service.ingestAll(List.of(
                    csv("inspections_slow.csv", "inspection_id,site,inspection_date,result\nINS-9,Plant A,2024-01-10,PASS\n"),
                    csv("inspections_fast.csv", "inspection_id,site,inspection_date,result\nINS-1,Plant A,2024-01-10,PASS\n")));

            assertEquals(2, summary.getDocuments());
            assertEquals(1, summary.getTimedOut());
            assertEquals(List.of("inspections_slow.csv"), summary.getTimedOutFiles());
            assertEquals(1, summary.getSucceeded());
            assertEquals(RunStatus.SUCCESS, summary.getResults().get(0).status());
        } finally {
            release.countDown();
        }
    }

    /** Tabular extraction that waits for a latch on files named {@code *slow*}. */
    private static final class BlocksOnSlowFiles implements DocumentExtractor {

        private final TabularExtractor delegate = new TabularExtractor(new CsvParserFactory(), new CompressionSupport());
        private final CountDownLatch release;

        BlocksOnSlowFiles(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public Set<SourceKind> supportedKinds() {
            return delegate.supportedKinds();
        }

        @Override
        public Stream<ExtractedRow> extract(RawDocument document) {
            if (document.filename().contains("slow")) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.extract(document);
        }
    }

    private static RawDocument csv(String filename, String content) {
        return RawDocument.ofBytes(filename, SourceKind.TABULAR, content.getBytes(StandardCharsets.UTF_8));
    }
}
