package com.moneylens.api.controller;

import com.moneylens.api.dto.BatchPredictRequest;
import com.moneylens.api.dto.ClassificationResponse;
import com.moneylens.api.dto.ClassifyRequest;
import com.moneylens.api.dto.CountResponse;
import com.moneylens.api.dto.OverrideRequest;
import com.moneylens.api.dto.OverrideResponse;
import com.moneylens.api.dto.PredictionResponse;
import com.moneylens.api.dto.TrainingSampleRequest;
import com.moneylens.api.dto.TransactionCategoryResponse;
import com.moneylens.categorization.TransactionCategorizationService;
import com.moneylens.categorization.model.ModelInfo;
import com.moneylens.categorization.model.Prediction;
import com.moneylens.categorization.model.StatisticalClassifier;
import com.moneylens.categorization.pipeline.ClassificationPipeline;
import com.moneylens.categorization.pipeline.ClassificationRequest;
import com.moneylens.categorization.pipeline.OverrideRegistration;
import com.moneylens.categorization.pipeline.PipelineStats;
import com.moneylens.categorization.training.RetrainingResult;
import com.moneylens.categorization.training.RetrainingService;
import com.moneylens.categorization.training.RetrainingStats;
import com.moneylens.categorization.training.RuleSuggestionResult;
import com.moneylens.categorization.training.RuleSuggestionService;
import com.moneylens.categorization.training.TrainingSampleService;
import com.moneylens.categorization.training.TrainingStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Classification, manual overrides, training corpus and retraining.
 */
@RestController
@RequestMapping("/api/v1/categorization")
@RequiredArgsConstructor
public class CategorizationController {

    private final ClassificationPipeline classificationPipeline;
    private final TransactionCategorizationService transactionCategorizationService;
    private final TrainingSampleService trainingSampleService;
    private final RetrainingService retrainingService;
    private final RuleSuggestionService ruleSuggestionService;
    private final StatisticalClassifier statisticalClassifier;

    @PostMapping("/classify")
    public Mono<ResponseEntity<ClassificationResponse>> classify(@Valid @RequestBody ClassifyRequest request) {
        ClassificationRequest classification = new ClassificationRequest(request.description(), request.merchant(),
                request.useAi(), request.useSemantic());
        return onWorker(() -> ResponseEntity.ok(
                ClassificationResponse.from(classificationPipeline.classify(classification))));
    }

    @PostMapping("/transactions/{id}/categorize")
    public Mono<ResponseEntity<TransactionCategoryResponse>> categorizeTransaction(@PathVariable String id) {
        return onWorker(() -> ResponseEntity.ok(
                TransactionCategoryResponse.from(transactionCategorizationService.categorize(id))));
    }

    @PostMapping("/transactions/categorize-uncategorized")
    public Mono<ResponseEntity<CountResponse>> categorizeUncategorized() {
        return onWorker(() -> ResponseEntity.ok(
                new CountResponse(transactionCategorizationService.categorizeUncategorized())));
    }

    @PutMapping("/transactions/{id}/category")
    public ResponseEntity<OverrideResponse> overrideCategory(@PathVariable String id,
                                                             @Valid @RequestBody OverrideRequest request) {
        boolean addSample = request.addTrainingSample() == null || request.addTrainingSample();
        OverrideRegistration registration = transactionCategorizationService.overrideCategory(
                id, request.category(), request.subcategory(), addSample);
        return ResponseEntity.ok(new OverrideResponse(id, registration.overrideCount(),
                registration.retrainTriggered(), registration.retraining()));
    }

    @PostMapping("/samples")
    public ResponseEntity<Void> addSample(@Valid @RequestBody TrainingSampleRequest request) {
        trainingSampleService.addSample(request.description(), request.category(), request.subcategory(),
                request.manual());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping("/samples/stats")
    public ResponseEntity<TrainingStats> sampleStats() {
        return ResponseEntity.ok(trainingSampleService.getStats());
    }

    @DeleteMapping("/samples")
    public ResponseEntity<Void> clearSamples() {
        trainingSampleService.clear();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/retrain")
    public ResponseEntity<RetrainingResult> retrain() {
        return ResponseEntity.ok(retrainingService.run());
    }

    @GetMapping("/retrain/stats")
    public ResponseEntity<RetrainingStats> retrainStats() {
        return ResponseEntity.ok(retrainingService.getStats());
    }

    @GetMapping("/model")
    public ResponseEntity<ModelInfo> modelInfo() {
        return ResponseEntity.ok(statisticalClassifier.getModelInfo());
    }

    @PostMapping("/model/predict")
    public ResponseEntity<List<PredictionResponse>> predictBatch(@Valid @RequestBody BatchPredictRequest request) {
        List<Optional<Prediction>> predictions = statisticalClassifier.predictBatch(request.descriptions());
        List<PredictionResponse> out = new ArrayList<>(predictions.size());
        for (int i = 0; i < predictions.size(); i++) {
            out.add(PredictionResponse.from(request.descriptions().get(i), predictions.get(i).orElse(null)));
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/stats")
    public ResponseEntity<PipelineStats> stats() {
        return ResponseEntity.ok(classificationPipeline.getStats());
    }

    @PostMapping("/rules/suggest")
    public ResponseEntity<RuleSuggestionResult> suggestRules() {
        return ResponseEntity.ok(ruleSuggestionService.suggestRules());
    }

    @DeleteMapping("/rules/suggested")
    public ResponseEntity<CountResponse> removeSuggestedRules() {
        return ResponseEntity.ok(new CountResponse(ruleSuggestionService.removeSuggestedRules()));
    }

    /** Classification waits on the embedding provider, which must not block a Netty event-loop thread. */
    private static <T> Mono<T> onWorker(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
