package dev.extractioneval.scorer;

import dev.extractioneval.model.DocumentEvaluationResult;
import java.util.List;
import java.util.function.Function;

/** Turns the evaluation of a document into scores between 0 (inclusive) and 1 (inclusive). */
public interface Scorer {
    String getName();

    List<Score> score(DocumentEvaluationResult evaluation);

    static Scorer of(String scorerName, Function<DocumentEvaluationResult, Double> scorerFn) {
        return new Scorer() {
            @Override
            public String getName() {
                return scorerName;
            }

            @Override
            public List<Score> score(DocumentEvaluationResult evaluation) {
                return List.of(new Score(scorerName, scorerFn.apply(evaluation)));
            }
        };
    }
}
