package com.cloudscheduler.engine;

import com.cloudscheduler.common.forecast.LstmWeights;
import com.cloudscheduler.common.model.MetricSample;
import com.cloudscheduler.engine.model.PredictionRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "engine.sequence.weights-path=classpath:lstm-test-weights.json",
        "engine.ensemble.num-trees=10"
    })
@AutoConfigureWebTestClient
class AiEngineApplicationTest {

    @Autowired
    private WebTestClient client;

    @Autowired
    private LstmWeights lstmWeights;

    @Test
    @DisplayName("weights artifact loaded from the configured location")
    void loadsConfiguredWeights() {
        assertEquals(1, lstmWeights.hiddenSize());
        assertEquals(1, lstmWeights.numLayers());
    }

    @Test
    @DisplayName("full context serves /predict end to end")
    void predictEndToEnd() {
        Instant start = Instant.parse("2024-06-01T00:00:00Z");
        List<MetricSample> history = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            history.add(MetricSample.of(start.plusSeconds(3600L * i), 40 + i % 5, 30, 20, 800));
        }
        client.post().uri("/api/v1/predict")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new PredictionRequest("vm-ctx", history, null, null))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.predictionHorizon").isEqualTo(24)
            .jsonPath("$.predictions.length()").isEqualTo(24)
            .jsonPath("$.predictions[0].timestamp").isNotEmpty();
    }

    // ── collaborator wire format ──────────────────────────────────────────

    private static String snakeCaseBody(int samples) {
        StringBuilder data = new StringBuilder();
        for (int i = 0; i < samples; i++) {
            if (i > 0) {
                data.append(',');
            }
            data.append(String.format(
                "{\"timestamp\":\"2024-06-01T%02d:00:00.123456\",\"cpu_usage_percent\":%d,"
                    + "\"memory_usage_percent\":35.5,\"disk_usage_percent\":20,"
                    + "\"network_in_bytes\":1200,\"network_out_bytes\":900}",
                i, 40 + i % 5));
        }
        return "{\"resource_id\":7,\"prediction_horizon\":6,\"historical_data\":[" + data + "]}";
    }

    @Test
    @DisplayName("snake_case body with offset-less timestamps and numeric resource id accepted")
    void predictCollaboratorPayload() {
        client.post().uri("/api/v1/predict")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(snakeCaseBody(24))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.resourceId").isEqualTo("7")
            .jsonPath("$.predictionHorizon").isEqualTo(6)
            .jsonPath("$.predictions.length()").isEqualTo(6);
    }

    @Test
    void recommendCollaboratorPayload() {
        client.post().uri("/api/v1/recommend")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(snakeCaseBody(24))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.forecast.predictions.length()").isEqualTo(6);
    }
}
