package com.example.studydesign.service;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Thread-local signal raised by collaborator fallback methods.
 *
 * Fallbacks return a safe empty value instead of throwing, so the pipeline checks this signal
 * after each collaborator call to tell "nothing found" apart from "collaborator unavailable".
 *
 * <pre>
 * try (FallbackSignal signal = fallbackSignal.acquire()) {
 *     List&lt;LiteratureReference&gt; refs = searchClient.search(drug, max);
 *     if (signal.isDegraded()) { ... }
 * }
 * </pre>
 *
 * Pipeline stages run on a single worker thread, so the ThreadLocal is visible to the caller.
 */
@Component
public class FallbackSignal implements AutoCloseable {

    private static final ThreadLocal<Degradation> DEGRADATION = new ThreadLocal<>();

    /**
     * Mark the current execution as degraded. The first degradation wins.
     */
    public void markDegraded(String collaborator, String reason) {
        if (DEGRADATION.get() == null) {
            DEGRADATION.set(new Degradation(collaborator, reason));
        }
    }

    public boolean isDegraded() {
        return DEGRADATION.get() != null;
    }

    public Optional<Degradation> degradation() {
        return Optional.ofNullable(DEGRADATION.get());
    }

    /**
     * Start a new scope. Clears anything left behind by a previous task on this pooled thread.
     */
    public FallbackSignal acquire() {
        DEGRADATION.remove();
        return this;
    }

    @Override
    public void close() {
        DEGRADATION.remove();
    }

    public record Degradation(String collaborator, String reason) {
    }
}
