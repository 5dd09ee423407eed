package com.regesh.inference;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regesh.config.InferenceConfig;
import com.regesh.model.LabelScore;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A classifier that calls a hosted text-classification endpoint over HTTP.
 *
 * <p>One batch is one POST request.  The request body is {@code {"inputs": [...texts]}}
 * and the response must be a JSON array with one element per input, each element being
 * the list of {@code {"label", "score"}} objects for that input.</p>
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code apiUrl} – the endpoint to POST batches to (required)</li>
 *   <li>{@code apiToken} – optional bearer token</li>
 *   <li>{@code timeoutMs} – connect and request timeout in milliseconds (default: 30000)</li>
 * </ul>
 */
@Slf4j
public class HttpClassifier implements Classifier {

    private String apiUrl;
    private String apiToken;
    private long timeoutMs;
    private HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void init(InferenceConfig config) {
        if (config.getApiUrl() == null || config.getApiUrl().isBlank()) {
            throw new IllegalStateException("inference apiUrl is not configured");
        }
        this.apiUrl = config.getApiUrl();
        this.apiToken = config.getApiToken();
        this.timeoutMs = config.getTimeoutMs();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        log.info("Initialised HttpClassifier → {} (model: {})", apiUrl, config.getModelName());
    }

    @Override
    public List<List<LabelScore>> classify(List<String> texts) throws Exception {
        if (httpClient == null) {
            throw new IllegalStateException("HttpClassifier used before init()");
        }

        byte[] body = objectMapper.writeValueAsBytes(Map.of("inputs", texts));
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofMillis(timeoutMs))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (apiToken != null && !apiToken.isBlank()) {
            request.header("Authorization", "Bearer " + apiToken);
        }

        HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IllegalStateException("Inference call failed: status=" + response.statusCode()
                    + " body=" + response.body());
        }

        List<List<LabelScore>> scores = objectMapper.readValue(response.body(), new TypeReference<>() {});
        if (scores.size() != texts.size()) {
            throw new IllegalStateException("Inference endpoint returned " + scores.size()
                    + " results for " + texts.size() + " inputs");
        }
        return scores;
    }

    @Override
    public void close() {
        log.info("Closed HttpClassifier for {}", apiUrl);
    }
}
