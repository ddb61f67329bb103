package com.storereplenishment.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.storereplenishment.exception.ModelServingException;
import com.storereplenishment.exception.ModelServingUnavailableException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

class ModelServingClientTest {

    private static WireMockServer wireMock;

    private ModelServingClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @BeforeEach
    void setUp() {
        client = new ModelServingClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        client.init();
    }

    private static void stubJson(String path, int status, String body) {
        wireMock.stubFor(post(urlEqualTo(path)).willReturn(aResponse()
            .withStatus(status)
            .withHeader("Content-Type", "application/json")
            .withBody(body)));
    }

    @Test
    void predict_returnsDemandAndSendsFeatures() {
        stubJson("/predict", 200, "{\"demand\": 12.5, \"model_version\": \"v3\"}");

        StepVerifier.create(client.predict("I-1", new double[]{1.0, 2.0}, "req-1"))
            .assertNext(p -> {
                assertThat(p.demand()).isEqualTo(12.5);
                assertThat(p.modelVersion()).isEqualTo("v3");
            })
            .verifyComplete();

        wireMock.verify(postRequestedFor(urlEqualTo("/predict"))
            .withHeader("X-Request-ID", equalTo("req-1"))
            .withRequestBody(matchingJsonPath("$.item_id", equalTo("I-1")))
            .withRequestBody(matchingJsonPath("$.features[1]")));
    }

    @Test
    void predict_clientErrorIsModelServingError() {
        stubJson("/predict", 400, "{\"detail\": \"bad vector\"}");

        StepVerifier.create(client.predict("I-1", new double[]{1.0}, "req-1"))
            .expectError(ModelServingException.class)
            .verify();
    }

    @Test
    void predict_serverErrorIsUnavailable() {
        stubJson("/predict", 503, "{\"detail\": \"loading\"}");

        StepVerifier.create(client.predict("I-1", new double[]{1.0}, "req-1"))
            .expectError(ModelServingUnavailableException.class)
            .verify();
    }

    @Test
    void predict_responseWithoutDemandIsRejected() {
        stubJson("/predict", 200, "{\"status\": \"ok\"}");

        StepVerifier.create(client.predict("I-1", new double[]{1.0}, "req-1"))
            .expectErrorMatches(ex -> ex instanceof ModelServingException && ex.getMessage().contains("demand"))
            .verify();
    }

    @Test
    void modelInfo_readsFeatureCount() {
        wireMock.stubFor(get(urlEqualTo("/model/info")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"feature_count\": 39, \"model_version\": \"v3\"}")));

        StepVerifier.create(client.modelInfo())
            .assertNext(info -> assertThat(info.featureCount()).isEqualTo(39))
            .verifyComplete();
    }

    @Test
    void isHealthy_falseWhenServiceErrors() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(500)));

        StepVerifier.create(client.isHealthy()).expectNext(false).verifyComplete();
    }

    @Test
    void isHealthy_trueWhenStatusOk() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"status\": \"ok\"}")));

        StepVerifier.create(client.isHealthy()).expectNext(true).verifyComplete();
    }
}
