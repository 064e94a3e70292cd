package com.sharedsolve.coordination;

import com.sharedsolve.config.SharedSolveProperties;
import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.fingerprint.TaskFingerprint;
import com.sharedsolve.store.SharedSolutionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decides per task whether this node generates an answer or reuses one a sibling published.
 *
 * <p>A waiter that finds nothing within its timeout, or finds the store down, generates
 * locally for that request; it does not wait again and does not re-check the store before
 * returning. Worst-case latency for a waiter is the wait timeout plus one local generation.
 * Failures from {@code generation} propagate to the caller unchanged.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinationRouter {

    private final SharedSolutionStore store;
    private final SharedSolveProperties properties;
    private final CoordinationMetricsService metricsService;

    public RoutedResult route(TaskFingerprint fingerprint, Supplier<ComponentResult> generation) {
        return route(properties.getCoordination().getRole(), fingerprint, generation);
    }

    public RoutedResult route(NodeRole role, TaskFingerprint fingerprint, Supplier<ComponentResult> generation) {
        return switch (role) {
            case SOLO -> RoutedResult.generated(generation.get());
            case PRODUCER -> produce(fingerprint, generation);
            case WAITER -> awaitShared(fingerprint, generation);
        };
    }

    private RoutedResult produce(TaskFingerprint fingerprint, Supplier<ComponentResult> generation) {
        ComponentResult result = generation.get();
        Duration ttl = properties.getCoordination().getSolutionTtl();
        boolean stored = store.put(fingerprint, result, ttl);
        metricsService.recordPublish(stored);
        if (stored) {
            log.info("Producer published solution for task {}", fingerprint.abbreviated());
        } else {
            log.warn("Producer failed to publish solution for task {}; returning local result", fingerprint.abbreviated());
        }
        return RoutedResult.generated(result);
    }

    private RoutedResult awaitShared(TaskFingerprint fingerprint, Supplier<ComponentResult> generation) {
        if (!store.isAvailable()) {
            log.error("Shared store not available for waiter, falling back to local generation (task {})",
                    fingerprint.abbreviated());
            metricsService.recordStoreUnavailable();
            return new RoutedResult(generation.get(), ResultSource.FALLBACK_GENERATED, Duration.ZERO);
        }
        SharedSolveProperties.Coordination coordination = properties.getCoordination();
        long start = System.nanoTime();
        Optional<ComponentResult> shared = store.waitFor(fingerprint, coordination.getWaitTimeout(),
                coordination.getPollInterval());
        Duration waited = Duration.ofNanos(System.nanoTime() - start);
        if (shared.isPresent()) {
            metricsService.recordSharedHit(waited);
            return new RoutedResult(shared.get(), ResultSource.SHARED, waited);
        }
        metricsService.recordWaitTimeout(waited);
        return new RoutedResult(generation.get(), ResultSource.FALLBACK_GENERATED, waited);
    }
}
