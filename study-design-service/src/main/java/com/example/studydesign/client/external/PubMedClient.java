package com.example.studydesign.client.external;

import com.example.studydesign.client.LiteratureSearchClient;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.LiteratureReference;
import com.example.studydesign.service.FallbackSignal;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client for NCBI E-utilities (PubMed).
 *
 * esearch finds PMIDs, esummary supplies titles, efetch returns plain-text abstracts.
 * Must be called outside any transaction. NCBI allows 3 req/s without an API key, 10 with one.
 */
@Component
@Slf4j
public class PubMedClient implements LiteratureSearchClient {

    static final String PMID_PREFIX = "PMID:";
    private static final String SEARCH_FILTER = "(pharmacokinetics OR bioequivalence OR bioavailability) AND healthy";

    private final WebClient pubMedWebClient;
    private final FallbackSignal fallbackSignal;
    private final String apiKey;
    private final String email;
    private final Duration timeout;

    public PubMedClient(@Qualifier("pubMedWebClient") WebClient pubMedWebClient,
                        FallbackSignal fallbackSignal,
                        @Value("${collaborators.pubmed.api-key:}") String apiKey,
                        @Value("${collaborators.pubmed.email:}") String email,
                        @Value("${collaborators.pubmed.timeout-seconds:30}") int timeoutSeconds) {
        this.pubMedWebClient = pubMedWebClient;
        this.fallbackSignal = fallbackSignal;
        this.apiKey = apiKey;
        this.email = email;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Search PubMed for pharmacokinetic studies of the drug in healthy volunteers.
     *
     * Query: {@code <INN> [OR <substance>...] AND (pharmacokinetics OR bioequivalence OR bioavailability) AND healthy}
     */
    @Override
    @Retry(name = NAME, fallbackMethod = "searchFallback")
    @CircuitBreaker(name = NAME)
    public List<LiteratureReference> search(DrugIdentifier drug, int maxResults) {
        String term = buildQuery(drug);
        log.debug("PubMed esearch term='{}', retmax={}", term, maxResults);

        Map<String, Object> response = get(builder -> withCredentials(builder
                .path("/esearch.fcgi")
                .queryParam("db", "pubmed")
                .queryParam("term", term)
                .queryParam("retmax", maxResults)
                .queryParam("retmode", "json")
                .queryParam("sort", "relevance"))
                .build());

        List<String> pmids = idList(response);
        if (pmids.isEmpty()) {
            log.info("No PubMed articles found for '{}'", drug.innEn());
            return List.of();
        }

        Map<String, String> titles = fetchTitles(pmids);
        log.info("PubMed search for '{}': {} article(s)", drug.innEn(), pmids.size());
        return pmids.stream()
                .map(pmid -> new LiteratureReference(PMID_PREFIX + pmid, titles.getOrDefault(pmid, "")))
                .toList();
    }

    @Override
    @Retry(name = NAME, fallbackMethod = "fetchDocumentTextFallback")
    @CircuitBreaker(name = NAME)
    public String fetchDocumentText(LiteratureReference reference) {
        String pmid = stripPrefix(reference.sourceRef());
        String text = pubMedWebClient.get()
                .uri(builder -> withCredentials(builder
                        .path("/efetch.fcgi")
                        .queryParam("db", "pubmed")
                        .queryParam("id", pmid)
                        .queryParam("rettype", "abstract")
                        .queryParam("retmode", "text"))
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, clientResponse -> {
                    log.error("PubMed efetch error: {}", clientResponse.statusCode());
                    return clientResponse.createException();
                })
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        return text == null ? "" : text.strip();
    }

    String buildQuery(DrugIdentifier drug) {
        String subject = drug.innEn().trim();
        if (!drug.additionalSubstances().isEmpty()) {
            subject = "(" + subject + " OR " + String.join(" OR ", drug.additionalSubstances()) + ")";
        }
        return subject + " AND " + SEARCH_FILTER;
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> fetchTitles(List<String> pmids) {
        Map<String, Object> response = get(builder -> withCredentials(builder
                .path("/esummary.fcgi")
                .queryParam("db", "pubmed")
                .queryParam("id", String.join(",", pmids))
                .queryParam("retmode", "json"))
                .build());

        Object result = response == null ? null : response.get("result");
        if (!(result instanceof Map<?, ?> summaries)) {
            return Map.of();
        }
        return pmids.stream()
                .filter(pmid -> summaries.get(pmid) instanceof Map<?, ?>)
                .collect(Collectors.toMap(
                        pmid -> pmid,
                        pmid -> String.valueOf(((Map<String, Object>) summaries.get(pmid)).getOrDefault("title", ""))));
    }

    @SuppressWarnings("unchecked")
    private List<String> idList(Map<String, Object> response) {
        if (response == null || !(response.get("esearchresult") instanceof Map<?, ?> result)) {
            return List.of();
        }
        Object ids = result.get("idlist");
        return ids instanceof List<?> list ? (List<String>) list : List.of();
    }

    private Map<String, Object> get(Function<UriBuilder, URI> uri) {
        return pubMedWebClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(status -> status == HttpStatus.TOO_MANY_REQUESTS, clientResponse -> {
                    log.warn("PubMed rate limit exceeded (429)");
                    return Mono.error(new PubMedClientException("PubMed rate limit exceeded"));
                })
                .onStatus(HttpStatusCode::isError, clientResponse -> {
                    log.error("PubMed error: {}", clientResponse.statusCode());
                    return clientResponse.createException();
                })
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(timeout)
                .block();
    }

    private UriBuilder withCredentials(UriBuilder builder) {
        if (!apiKey.isBlank()) {
            builder.queryParam("api_key", apiKey);
        }
        if (!email.isBlank()) {
            builder.queryParam("email", email);
        }
        return builder;
    }

    private static String stripPrefix(String sourceRef) {
        return sourceRef.startsWith(PMID_PREFIX) ? sourceRef.substring(PMID_PREFIX.length()) : sourceRef;
    }

    /**
     * Called when retries are exhausted or the circuit is open.
     */
    private List<LiteratureReference> searchFallback(DrugIdentifier drug, int maxResults, Throwable throwable) {
        String errorMsg = String.format("PubMed search unavailable for '%s': %s", drug.innEn(), throwable.getMessage());
        log.warn("⚠️ FALLBACK TRIGGERED: {}", errorMsg, throwable);
        fallbackSignal.markDegraded(NAME, errorMsg);
        return List.of();
    }

    private String fetchDocumentTextFallback(LiteratureReference reference, Throwable throwable) {
        String errorMsg = String.format("PubMed efetch unavailable for %s: %s", reference.sourceRef(), throwable.getMessage());
        log.warn("⚠️ FALLBACK TRIGGERED: {}", errorMsg, throwable);
        fallbackSignal.markDegraded(NAME, errorMsg);
        return "";
    }

    public static class PubMedClientException extends RuntimeException {
        public PubMedClientException(String message) {
            super(message);
        }
    }
}
