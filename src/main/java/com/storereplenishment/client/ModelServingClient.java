package com.storereplenishment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storereplenishment.exception.ModelServingException;
import com.storereplenishment.exception.ModelServingUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the external demand model. The model receives the vector built by
 * {@link com.storereplenishment.forecast.FeatureVectorBuilder} and answers with a
 * daily demand estimate.
 */
@Slf4j
@Component
public class ModelServingClient {

    @Value("${model.api.base-url}")
    private String baseUrl;

    @Value("${model.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("ModelServingClient initialised → {}", baseUrl);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Mono<ModelPrediction> predict(String itemId, double[] features, String requestId) {
        return webClient.post().uri("/predict")
            .header("X-Request-ID", requestId)
            .bodyValue(buildBody(itemId, features))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new ModelServingException("Model rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new ModelServingUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toPrediction)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new ModelServingUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, ModelServingUnavailableException::new);
    }

    public Mono<ModelInfo> modelInfo() {
        return webClient.get().uri("/model/info").retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::toModelInfo)
            .onErrorMap(WebClientRequestException.class, ModelServingUnavailableException::new);
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private ModelPrediction toPrediction(JsonNode json) {
        if (json == null || !json.hasNonNull("demand")) {
            throw new ModelServingException("Model response missing 'demand': " + String.valueOf(json));
        }
        String version = json.hasNonNull("model_version") ? json.get("model_version").asText() : null;
        return new ModelPrediction(json.get("demand").asDouble(), version);
    }

    private ModelInfo toModelInfo(JsonNode json) {
        if (json == null || !json.hasNonNull("feature_count")) {
            throw new ModelServingException("Model info missing 'feature_count': " + String.valueOf(json));
        }
        String version = json.hasNonNull("model_version") ? json.get("model_version").asText() : "unknown";
        return new ModelInfo(json.get("feature_count").asInt(), version);
    }

    private ObjectNode buildBody(String itemId, double[] features) {
        ObjectNode node = mapper.createObjectNode();
        node.put("item_id", itemId);
        ArrayNode values = node.putArray("features");
        for (double value : features) {
            values.add(value);
        }
        return node;
    }

    public record ModelPrediction(double demand, String modelVersion) {}

    public record ModelInfo(int featureCount, String modelVersion) {}
}
