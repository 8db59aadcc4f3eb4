package com.di.compliance.config;

import com.di.compliance.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for batch ingestion. One document per task; MDC follows the task.
 */
@Slf4j
@Configuration
public class IngestionExecutorConfiguration {

    @Bean(name = "ingestionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService ingestionExecutor(IngestionProperties properties) {
        int workers = Math.max(1, properties.getWorkerCount());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "ingest-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("[BATCH] ingestion executor workers={}", workers);
        return MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(workers, tf));
    }
}
