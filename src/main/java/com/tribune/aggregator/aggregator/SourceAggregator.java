package com.tribune.aggregator.aggregator;

import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one unit of work per source on the ingestion pool and waits for all of them.
 * Every future settles: an exception or timeout becomes that source's failed result,
 * so one source can never abort or hold back the others.
 */
@Slf4j
@Component
public class SourceAggregator {

    private final Executor executor;

    @Value("${ingestion.source-timeout-seconds:120}")
    private long sourceTimeoutSeconds;

    public SourceAggregator(@Qualifier("ingestionExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * @return one result per source, in the order of {@code sources}
     */
    public List<SourceRunResult> aggregateAsync(List<Source> sources, Function<Source, SourceRunResult> work) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        List<CompletableFuture<SourceRunResult>> futures = sources.stream()
                .map(src -> submit(mdc, src, work)
                        .exceptionally(ex -> {
                            String error = describe(ex);
                            log.warn("Source {} failed: sourceId={} err={}", src.getName(), src.getId(), error);
                            return SourceRunResult.failed(src, error);
                        }))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    // The deadline is armed when a worker picks the source up, so time spent queued
    // behind other sources does not count against it.
    private CompletableFuture<SourceRunResult> submit(Map<String, String> mdc, Source src,
                                                      Function<Source, SourceRunResult> work) {
        CompletableFuture<SourceRunResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                future.orTimeout(sourceTimeoutSeconds, TimeUnit.SECONDS);
                try {
                    future.complete(runWithMdc(mdc, src, work));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private static SourceRunResult runWithMdc(Map<String, String> mdc, Source src, Function<Source, SourceRunResult> work) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) MDC.setContextMap(mdc);
        try {
            SourceRunResult result = work.apply(src);
            log.info("Fetched {} new articles from {} sourceId={} success={}",
                    result.getArticleCount(), src.getName(), src.getId(), result.isSuccess());
            return result;
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private String describe(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Timed out after " + sourceTimeoutSeconds + "s";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
