package com.di.compliance.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC from the submitting thread to document workers, and scopes the
 * per-document keys ({@link #DOCUMENT_FILE}, {@link #DOCUMENT_ID}) for the duration of one ingestion.
 * <p>
 * MDC is thread-local; without propagation, logs written on the batch executor lose the
 * caller's context.
 */
public final class MdcPropagation {

    public static final String DOCUMENT_FILE = "documentFile";
    public static final String DOCUMENT_ID   = "documentId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration
     * of the task on whichever thread runs it, clearing it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * Puts the document keys into MDC; the returned handle removes them again on close.
     * <pre>{@code
     * try (MDC.MDCCloseable ignored = MdcPropagation.documentScope(filename)) { ... }
     * }</pre>
     */
    public static MDC.MDCCloseable documentScope(String filename) {
        return MDC.putCloseable(DOCUMENT_FILE, filename);
    }

    public static void setDocumentId(Long documentId) {
        if (documentId != null) {
            MDC.put(DOCUMENT_ID, String.valueOf(documentId));
        }
    }

    public static void clearDocumentId() {
        MDC.remove(DOCUMENT_ID);
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
