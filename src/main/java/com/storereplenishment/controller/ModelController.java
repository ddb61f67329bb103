package com.storereplenishment.controller;

import com.storereplenishment.client.ModelServingClient;
import com.storereplenishment.dto.TrainingSetResponse;
import com.storereplenishment.forecast.FeatureVectorBuilder;
import com.storereplenishment.service.TrainingSetService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Map;

@Validated
@RestController
@RequestMapping("/api/v1/model")
@RequiredArgsConstructor
public class ModelController {

    private final TrainingSetService trainingSetService;
    private final ModelServingClient modelServingClient;
    private final FeatureVectorBuilder featureVectorBuilder;

    @GetMapping("/training-set")
    public ResponseEntity<TrainingSetResponse> trainingSet(
            @RequestParam @NotBlank String itemId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(trainingSetService.trainingSet(itemId, from, to));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return modelServingClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of(
                "modelService", healthy ? "UP" : "DOWN",
                "featureCount", featureVectorBuilder.featureCount());
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }
}
