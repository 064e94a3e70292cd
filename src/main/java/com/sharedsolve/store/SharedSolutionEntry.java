package com.sharedsolve.store;

import com.sharedsolve.extraction.ComponentResult;
import com.sharedsolve.fingerprint.TaskFingerprint;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A published solution as it sits in the shared store.
 */
public record SharedSolutionEntry(TaskFingerprint fingerprint, ComponentResult payload, @Nullable Instant storedAt) {
}
