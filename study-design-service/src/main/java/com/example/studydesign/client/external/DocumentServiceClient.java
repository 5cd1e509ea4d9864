package com.example.studydesign.client.external;

import com.example.studydesign.client.ReportRenderer;
import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.exception.CollaboratorUnavailableException;
import com.example.studydesign.service.FallbackSignal;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Client for the document rendering service that produces study synopses.
 *
 * Posts the design, verdict and drug metadata as JSON and receives {@code {artifactRef, mediaType}}.
 */
@Component
@Slf4j
public class DocumentServiceClient implements ReportRenderer {

    private static final String SYNOPSIS_PATH = "/api/v1/documents/synopsis";

    private final WebClient reportWebClient;
    private final FallbackSignal fallbackSignal;
    private final Duration timeout;

    public DocumentServiceClient(@Qualifier("reportWebClient") WebClient reportWebClient,
                                 FallbackSignal fallbackSignal,
                                 @Value("${collaborators.report.timeout-seconds:60}") int timeoutSeconds) {
        this.reportWebClient = reportWebClient;
        this.fallbackSignal = fallbackSignal;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    @Retry(name = NAME, fallbackMethod = "renderFallback")
    @CircuitBreaker(name = NAME)
    public ReportArtifact render(DesignResult design, RegulatoryVerdict verdict, DrugIdentifier drug) {
        Map<String, Object> request = Map.of(
                "drug", drug,
                "design", design,
                "verdict", verdict);

        RenderResponse response = reportWebClient.post()
                .uri(SYNOPSIS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse -> {
                    log.error("Document service error: {}", clientResponse.statusCode());
                    return clientResponse.createException();
                })
                .bodyToMono(RenderResponse.class)
                .timeout(timeout)
                .block();

        if (response == null || response.artifactRef() == null || response.artifactRef().isBlank()) {
            throw new DocumentServiceException("Document service returned no artifact reference");
        }
        log.info("Rendered synopsis for '{}': {}", drug.innEn(), response.artifactRef());
        return new ReportArtifact(response.artifactRef(), response.mediaType(), Instant.now());
    }

    /**
     * Rendering has no degraded result to fall back to; the caller gets a 503.
     */
    private ReportArtifact renderFallback(DesignResult design, RegulatoryVerdict verdict, DrugIdentifier drug, Throwable throwable) {
        String errorMsg = String.format("Report rendering unavailable for '%s': %s", drug.innEn(), throwable.getMessage());
        log.warn("⚠️ FALLBACK TRIGGERED: {}", errorMsg, throwable);
        fallbackSignal.markDegraded(NAME, errorMsg);
        throw new CollaboratorUnavailableException(NAME, errorMsg, throwable);
    }

    record RenderResponse(String artifactRef, String mediaType) {
    }

    public static class DocumentServiceException extends RuntimeException {
        public DocumentServiceException(String message) {
            super(message);
        }
    }
}
