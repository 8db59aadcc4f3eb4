package com.di.compliance.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one batch over the inbound folder at start-up when {@code compliance.ingestion.run-on-startup=true}.
 * An optional first argument overrides the folder.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "compliance.ingestion", name = "run-on-startup", havingValue = "true")
public class IngestionRunner implements ApplicationRunner {

    private final BatchIngestionService batchIngestionService;

    @Override
    public void run(ApplicationArguments args) {
        BatchSummary summary = args.getNonOptionArgs().isEmpty()
                ? batchIngestionService.ingestFolder()
                : batchIngestionService.ingestFolder(Path.of(args.getNonOptionArgs().get(0)));
        log.info("[BATCH] start-up run finished: documents={} new={} known={} succeeded={} partial={} failed={} timedOut={}",
                summary.getDocuments(), summary.getNewDocuments(), summary.getKnownDocuments(),
                summary.getSucceeded(), summary.getPartial(), summary.getFailed(), summary.getTimedOut());
    }
}
