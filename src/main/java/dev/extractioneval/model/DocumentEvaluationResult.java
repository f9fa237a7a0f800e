package dev.extractioneval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.extractioneval.aggregate.ResultAggregator;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Evaluation of one document: the compared records and every field result. */
public record DocumentEvaluationResult(
        @Nonnull String documentId,
        @Nonnull Map<String, Object> expectedData,
        @Nonnull Map<String, Object> extractedData,
        @Nonnull List<FieldEvaluationResult> fieldResults,
        /** time the extraction took, when the caller measured it */
        Optional<Long> extractionTimeMs,
        /** set when the document could not be extracted or evaluated */
        Optional<String> error,
        @Nonnull Instant createdAt) {

    public DocumentEvaluationResult {
        expectedData = Collections.unmodifiableMap(new LinkedHashMap<>(expectedData));
        extractedData = Collections.unmodifiableMap(new LinkedHashMap<>(extractedData));
        fieldResults = List.copyOf(fieldResults);
    }

    public static DocumentEvaluationResult success(
            String documentId,
            Map<String, Object> expectedData,
            Map<String, Object> extractedData,
            List<FieldEvaluationResult> fieldResults,
            @Nullable Long extractionTimeMs) {
        return new DocumentEvaluationResult(
                documentId,
                expectedData,
                extractedData,
                fieldResults,
                Optional.ofNullable(extractionTimeMs),
                Optional.empty(),
                Instant.now());
    }

    public static DocumentEvaluationResult failure(
            String documentId, Map<String, Object> expectedData, String error) {
        return new DocumentEvaluationResult(
                documentId,
                expectedData,
                Map.of(),
                List.of(),
                Optional.empty(),
                Optional.of(error),
                Instant.now());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error.isEmpty();
    }

    /** Overall weighted accuracy, zero for a failed document. */
    public double accuracy() {
        return aggregator().overallAccuracy();
    }

    /** Correctness of each field keyed by display name. */
    @JsonIgnore
    public Map<String, Boolean> fieldAccuracies() {
        return aggregator().fieldAccuracies();
    }

    public ResultAggregator aggregator() {
        return new ResultAggregator(fieldResults);
    }
}
