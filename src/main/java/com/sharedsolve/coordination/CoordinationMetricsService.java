package com.sharedsolve.coordination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class CoordinationMetricsService {

    private final AtomicLong generationCount = new AtomicLong();
    private final AtomicLong sharedHitCount = new AtomicLong();
    private final AtomicLong waitTimeoutCount = new AtomicLong();
    private final AtomicLong storeUnavailableCount = new AtomicLong();
    private final AtomicLong publishCount = new AtomicLong();
    private final AtomicLong publishFailureCount = new AtomicLong();

    public void recordGeneration(String component, @Nullable String cid) {
        long count = generationCount.incrementAndGet();
        if (StringUtils.hasText(cid)) {
            log.info("Generator request #{} sent (component={}, cid={}).", count, component, cid);
        } else {
            log.info("Generator request #{} sent (component={}).", count, component);
        }
    }

    public void recordSharedHit(Duration waited) {
        long hits = sharedHitCount.incrementAndGet();
        log.info("Reused shared solution after {} ms. Total shared hits={}.", waited.toMillis(), hits);
    }

    public void recordWaitTimeout(Duration waited) {
        long timeouts = waitTimeoutCount.incrementAndGet();
        log.info("No shared solution after {} ms, generating locally. Total wait timeouts={}.", waited.toMillis(), timeouts);
    }

    public void recordStoreUnavailable() {
        long count = storeUnavailableCount.incrementAndGet();
        log.info("Shared store unavailable, generating locally. Total unavailable={}.", count);
    }

    public void recordPublish(boolean success) {
        if (success) {
            publishCount.incrementAndGet();
        } else {
            publishFailureCount.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(generationCount.get(), sharedHitCount.get(), waitTimeoutCount.get(),
                storeUnavailableCount.get(), publishCount.get(), publishFailureCount.get());
    }

    public void logSummary() {
        Snapshot s = snapshot();
        log.info("Coordination stats: generations={}, sharedHits={}, waitTimeouts={}, storeUnavailable={}, published={}, publishFailures={}.",
                s.generations(), s.sharedHits(), s.waitTimeouts(), s.storeUnavailable(), s.published(), s.publishFailures());
    }

    public record Snapshot(long generations,
                           long sharedHits,
                           long waitTimeouts,
                           long storeUnavailable,
                           long published,
                           long publishFailures) {
    }
}
