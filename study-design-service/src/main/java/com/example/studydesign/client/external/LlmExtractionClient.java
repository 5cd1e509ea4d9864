package com.example.studydesign.client.external;

import com.example.studydesign.client.ParameterExtractionClient;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.service.FallbackSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for a hosted LLM completion endpoint (YandexGPT request shape).
 *
 * The model is asked for a strict JSON object keyed by parameter label, each entry
 * {@code {"value": <number>, "unit": "...", "found": true}}. When the general pass finds no
 * CV_intra, a second pass asks for CV_intra alone; intra-subject variability is often reported
 * in wording the general prompt misses.
 */
@Component
@Slf4j
public class LlmExtractionClient implements ParameterExtractionClient {

    private static final String COMPLETION_PATH = "/foundationModels/v1/completion";

    private static final String GENERAL_PROMPT = """
            You are an expert clinical pharmacologist.
            Extract pharmacokinetic parameters for the drug %s from the scientific text.

            Standard units (convert to these, or omit the parameter):
            - Cmax: ng/mL
            - AUC: ng*h/mL
            - Tmax: h
            - T1/2: h
            - CV_intra: %% (percent, e.g. 15.5 not 0.155)

            Rules:
            1. CV_intra means INTRA-individual (within-subject) variability only, never inter-individual.
            2. Prefer data from studies in healthy volunteers.
            3. Use null for parameters not found.

            Respond with strict JSON only, no markdown:
            {"Cmax": {"value": <number>, "unit": "ng/mL", "found": true},
             "AUC": {"value": <number>, "unit": "ng*h/mL", "found": true},
             "Tmax": {"value": <number>, "unit": "h", "found": true},
             "T1/2": {"value": <number>, "unit": "h", "found": true},
             "CV_intra": {"value": <number>, "unit": "%%", "found": true}}
            """;

    private static final String CV_INTRA_PROMPT = """
            You are an expert in bioequivalence statistics.
            Extract ONLY the intra-subject variability of %s from the text.
            Treat intra-subject CV, within-subject CV, intrasubject variability and residual variability
            of a crossover bioequivalence study as CV_intra. Ignore inter-subject variability.

            Respond with strict JSON only:
            {"CV_intra": {"value": <number>, "unit": "%%", "found": true}}
            If absent: {"CV_intra": {"value": null, "unit": "%%", "found": false}}
            """;

    private final WebClient extractionWebClient;
    private final FallbackSignal fallbackSignal;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String folderId;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;

    public LlmExtractionClient(@Qualifier("extractionWebClient") WebClient extractionWebClient,
                               FallbackSignal fallbackSignal,
                               ObjectMapper objectMapper,
                               @Value("${collaborators.extraction.api-key:}") String apiKey,
                               @Value("${collaborators.extraction.folder-id:}") String folderId,
                               @Value("${collaborators.extraction.model:aliceai-llm/latest}") String model,
                               @Value("${collaborators.extraction.temperature:0.1}") double temperature,
                               @Value("${collaborators.extraction.max-tokens:500}") int maxTokens,
                               @Value("${collaborators.extraction.timeout-seconds:60}") int timeoutSeconds) {
        this.extractionWebClient = extractionWebClient;
        this.fallbackSignal = fallbackSignal;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.folderId = folderId;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    @Retry(name = NAME, fallbackMethod = "extractFallback")
    @CircuitBreaker(name = NAME)
    public List<ExtractedParameter> extract(String documentText, DrugIdentifier drug) {
        if (documentText == null || documentText.isBlank()) {
            return List.of();
        }
        if (apiKey.isBlank() || folderId.isBlank()) {
            throw new ExtractionClientException("Extraction credentials not configured");
        }

        List<ExtractedParameter> candidates = new ArrayList<>(parseCandidates(
                complete(GENERAL_PROMPT.formatted(drug.innEn()),
                        "Extract pharmacokinetic parameters from this abstract:\n\n" + documentText)));

        boolean cvFound = candidates.stream().anyMatch(c -> c.kind() == ParameterKind.CV_INTRA);
        if (!cvFound) {
            List<ExtractedParameter> cvOnly = parseCandidates(
                    complete(CV_INTRA_PROMPT.formatted(drug.innEn()),
                            "Extract CV_intra from this abstract:\n\n" + documentText));
            cvOnly.stream()
                    .filter(c -> c.kind() == ParameterKind.CV_INTRA)
                    .forEach(candidates::add);
            log.debug("Targeted CV_intra pass for '{}': found={}", drug.innEn(), !cvOnly.isEmpty());
        }

        log.info("Extracted {} candidate(s) for '{}'", candidates.size(), drug.innEn());
        return candidates;
    }

    /**
     * Sends one completion request and returns the model's text answer with code fences removed.
     */
    private String complete(String systemPrompt, String userMessage) {
        Map<String, Object> payload = Map.of(
                "modelUri", "gpt://" + folderId + "/" + model,
                "completionOptions", Map.of(
                        "stream", false,
                        "temperature", temperature,
                        "maxTokens", maxTokens),
                "messages", List.of(
                        Map.of("role", "system", "text", systemPrompt),
                        Map.of("role", "user", "text", userMessage)));

        JsonNode response = extractionWebClient.post()
                .uri(COMPLETION_PATH)
                .header("Authorization", "Api-Key " + apiKey)
                .header("x-folder-id", folderId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(status -> status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN, clientResponse -> {
                    log.error("Extraction endpoint rejected credentials ({})", clientResponse.statusCode());
                    return Mono.error(new ExtractionClientException("Extraction credentials rejected"));
                })
                .onStatus(HttpStatusCode::isError, clientResponse -> {
                    log.error("Extraction endpoint error: {}", clientResponse.statusCode());
                    return clientResponse.createException();
                })
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();

        JsonNode alternatives = response == null ? null : response.path("result").path("alternatives");
        if (alternatives == null || !alternatives.isArray() || alternatives.isEmpty()) {
            log.warn("No alternatives in completion response");
            return "";
        }
        return stripCodeFences(alternatives.get(0).path("message").path("text").asText(""));
    }

    /**
     * Parses the model answer. Unparsable text yields no candidates.
     */
    List<ExtractedParameter> parseCandidates(String answer) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(answer);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse completion as JSON: {}", abbreviate(answer));
            return List.of();
        }
        if (root == null || !root.isObject()) {
            return List.of();
        }

        List<ExtractedParameter> candidates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<ParameterKind> kind = ParameterKind.fromName(field.getKey());
            if (kind.isEmpty()) {
                log.debug("Ignoring unknown parameter '{}'", field.getKey());
                continue;
            }
            toCandidate(kind.get(), field.getValue()).ifPresent(candidates::add);
        }
        return candidates;
    }

    private Optional<ExtractedParameter> toCandidate(ParameterKind kind, JsonNode entry) {
        if (entry == null || !entry.isObject() || !entry.path("found").asBoolean(false)) {
            return Optional.empty();
        }
        JsonNode value = entry.get("value");
        Double number = null;
        if (value != null && value.isNumber()) {
            number = value.asDouble();
        } else if (value != null && value.isTextual()) {
            try {
                number = Double.parseDouble(value.asText().trim().replace(',', '.'));
            } catch (NumberFormatException e) {
                log.debug("Non-numeric {} value '{}'", kind.label(), value.asText());
            }
        }
        if (number == null) {
            return Optional.empty();
        }
        return Optional.of(ExtractedParameter.builder()
                .kind(kind)
                .value(number)
                .unit(entry.path("unit").asText(kind == ParameterKind.CV_INTRA ? "%" : ""))
                .reliable(true)
                .build());
    }

    static String stripCodeFences(String text) {
        String stripped = text.strip();
        if (stripped.startsWith("```")) {
            int newline = stripped.indexOf('\n');
            stripped = newline >= 0 ? stripped.substring(newline + 1) : stripped.substring(3);
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped.strip();
    }

    private static String abbreviate(String text) {
        return text.length() <= 150 ? text : text.substring(0, 150) + "...";
    }

    /**
     * Called when retries are exhausted or the circuit is open.
     */
    private List<ExtractedParameter> extractFallback(String documentText, DrugIdentifier drug, Throwable throwable) {
        String errorMsg = String.format("Parameter extraction unavailable for '%s': %s", drug.innEn(), throwable.getMessage());
        log.warn("⚠️ FALLBACK TRIGGERED: {}", errorMsg, throwable);
        fallbackSignal.markDegraded(NAME, errorMsg);
        return List.of();
    }

    public static class ExtractionClientException extends RuntimeException {
        public ExtractionClientException(String message) {
            super(message);
        }
    }
}
