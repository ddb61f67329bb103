package com.storereplenishment.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storereplenishment.exception.OrderExecutionException;
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
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class HttpOrderExecutionGateway implements OrderExecutionGateway {

    @Value("${order-execution.enabled:false}")
    private boolean enabled;

    @Value("${order-execution.base-url}")
    private String baseUrl;

    @Value("${order-execution.timeout-seconds:15}")
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
        log.info("Order execution gateway initialised → {} | enabled={}", baseUrl, enabled);
    }

    @Override
    public int submit(String storeId, LocalDate orderDate, List<OrderLine> lines, String requestId) {
        if (lines.isEmpty()) {
            return 0;
        }
        if (!enabled) {
            lines.forEach(line -> log.info("Order (not sent) | store={} | item={} | qty={} | decision={}",
                                           storeId, line.itemId(), line.qty(), line.decision()));
            return 0;
        }
        JsonNode response = webClient.post().uri("/orders")
            .header("X-Request-ID", requestId)
            .bodyValue(buildBody(storeId, orderDate, lines))
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new OrderExecutionException("Order executor rejected submission (" + resp.statusCode().value() + "): " + b)))
            .bodyToMono(JsonNode.class)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(500))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new OrderExecutionException("Order executor unreachable", sig.failure())))
            .block(Duration.ofSeconds(timeoutSeconds * 3L));
        int accepted = response != null && response.hasNonNull("accepted") ? response.get("accepted").asInt() : lines.size();
        log.info("Orders submitted | store={} | date={} | lines={} | accepted={} | requestId={}",
                 storeId, orderDate, lines.size(), accepted, requestId);
        return accepted;
    }

    private ObjectNode buildBody(String storeId, LocalDate orderDate, List<OrderLine> lines) {
        ObjectNode node = mapper.createObjectNode();
        node.put("store_id", storeId);
        node.put("order_date", orderDate.format(DateTimeFormatter.ISO_DATE));
        ArrayNode items = node.putArray("items");
        for (OrderLine line : lines) {
            ObjectNode item = items.addObject();
            item.put("item_id", line.itemId());
            item.put("qty", line.qty());
            item.put("decision", line.decision().name());
        }
        return node;
    }
}
