package com.williamcallahan.baptismdesk.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for the OCR inference service's {@code /extract} endpoint.
 *
 * <p>One request per profile, no retries. Every failure is raised as an
 * {@link InferenceServiceException} so the extraction can be re-triggered manually with the
 * profile left untouched.</p>
 */
public class InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(InferenceClient.class);

    private static final String EXTRACT_PATH = "/extract";
    private static final String RESULT_FIELD = "parse_ocr_result";
    private static final int MAX_ERROR_SNIPPET = 512;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Creates a client over a RestTemplate that already carries connect and read timeouts.
     *
     * @param restTemplate configured RestTemplate
     * @param objectMapper parses response bodies
     */
    public InferenceClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Asks the inference service to read the uploaded image of a profile.
     *
     * @param baseUrl endpoint base, with or without a trailing slash
     * @param profileId profile whose {@code {id}.jpg} is read
     * @return raw OCR fields
     * @throws InferenceServiceException on transport failure, non-200 status or malformed body
     */
    public OcrResult extract(String baseUrl, String profileId) {
        String url = stripTrailingSlash(baseUrl) + EXTRACT_PATH;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<ExtractRequestPayload> entity = new HttpEntity<>(new ExtractRequestPayload(profileId + ".jpg"), headers);

        log.info("[INFERENCE] Requesting extraction for {} from {}", profileId, url);
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, entity, String.class);
        } catch (RestClientResponseException httpFailure) {
            int status = httpFailure.getStatusCode().value();
            throw new InferenceServiceException(status, formatHttpFailure(status, httpFailure.getResponseBodyAsString()),
                    httpFailure);
        } catch (ResourceAccessException transportFailure) {
            throw new InferenceServiceException(InferenceServiceException.Kind.TRANSPORT,
                    "Inference request to " + url + " failed: " + sanitizeMessage(transportFailure.getMessage()),
                    transportFailure);
        } catch (RestClientException clientFailure) {
            throw new InferenceServiceException(InferenceServiceException.Kind.TRANSPORT,
                    "Inference request to " + url + " failed: " + sanitizeMessage(clientFailure.getMessage()),
                    clientFailure);
        }

        int status = response.getStatusCode().value();
        if (status != 200) {
            throw new InferenceServiceException(status, formatHttpFailure(status, response.getBody()), null);
        }
        OcrResult result = parseResponse(response.getBody());
        log.debug("[INFERENCE] Result for {}: {}", profileId, result);
        return result;
    }

    private OcrResult parseResponse(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("Inference response body was empty", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException parseFailure) {
            throw malformed("Inference response was not valid JSON: " + sanitizeMessage(body), parseFailure);
        }
        JsonNode result = root.get(RESULT_FIELD);
        if (result == null || !result.isObject()) {
            throw malformed("Inference response missing " + RESULT_FIELD + " object", null);
        }
        return new OcrResult(
                textOrNull(result, "name_cn"),
                textOrNull(result, "name_pinyin"),
                textOrNull(result, "birthday"),
                textOrNull(result, "baptism_date"));
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static InferenceServiceException malformed(String message, Throwable cause) {
        return new InferenceServiceException(InferenceServiceException.Kind.MALFORMED_RESPONSE, message, cause);
    }

    private static String stripTrailingSlash(String baseUrl) {
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String formatHttpFailure(int status, String body) {
        String payload = sanitizeMessage(body);
        if (!payload.isBlank()) {
            return "Inference server returned HTTP " + status + ": " + payload;
        }
        return "Inference server returned HTTP " + status;
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    private record ExtractRequestPayload(String filename) {}
}
