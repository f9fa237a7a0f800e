package dev.extractioneval.scorer;

import dev.extractioneval.aggregate.ResultAggregator;
import dev.extractioneval.model.DocumentEvaluationResult;
import java.util.List;

/**
 * Reports the weighted accuracy of a document overall, over its line items, and over its other
 * fields. A failed document scores zero on all three.
 */
public class ExtractionAccuracyScorer implements Scorer {
    public static final String NAME = "extraction_accuracy";
    public static final String ITEMS = "items_accuracy";
    public static final String FIELDS = "fields_accuracy";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Score> score(DocumentEvaluationResult evaluation) {
        if (!evaluation.isSuccess()) {
            return List.of(new Score(NAME, 0.0), new Score(ITEMS, 0.0), new Score(FIELDS, 0.0));
        }
        var aggregator = evaluation.aggregator();
        var fields = new ResultAggregator(aggregator.nonItemsResults());
        return List.of(
                new Score(NAME, aggregator.overallAccuracy()),
                new Score(ITEMS, aggregator.itemsAccuracy()),
                new Score(FIELDS, fields.overallAccuracy()));
    }
}
