package com.policyparser.discovery;

import com.policyparser.discovery.scoring.DimensionMismatchException;
import com.policyparser.discovery.scoring.NeuralScorer;
import com.policyparser.discovery.scoring.ScoringModel;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NeuralScorerTest {
    private final NeuralScorer scorer = new NeuralScorer();

    private static double[] input(double value) {
        double[] in = new double[ScoringModel.INPUT_NODES];
        Arrays.fill(in, value);
        return in;
    }

    @Test
    void predictionIsAProbabilityAndDeterministic() {
        ScoringModel model = ScoringModel.initialize(new Random(42), 0.1);
        double first = scorer.predict(model, input(0.5));
        assertTrue(first > 0 && first < 1);
        assertEquals(first, scorer.predict(model, input(0.5)));
        assertEquals(first, scorer.predict(ScoringModel.initialize(new Random(42), 0.1), input(0.5)));
    }

    @Test
    void trainingReturnsNextGenerationAndLeavesInputModelUntouched() {
        ScoringModel model = ScoringModel.initialize(new Random(7), 0.1);
        double before = scorer.predict(model, input(1.0));

        ScoringModel next = scorer.train(model, input(1.0), 1.0);

        assertEquals(model.generation() + 1, next.generation());
        assertEquals(before, scorer.predict(model, input(1.0)));
        assertNotEquals(before, scorer.predict(next, input(1.0)));
    }

    @Test
    void repeatedPositiveExamplesRaiseTheScore() {
        ScoringModel model = ScoringModel.initialize(new Random(3), 0.1);
        double before = scorer.predict(model, input(1.0));
        for (int i = 0; i < 50; i++) {
            model = scorer.train(model, input(1.0), 1.0);
        }
        assertTrue(scorer.predict(model, input(1.0)) > before);
        assertEquals(50, model.generation());
    }

    @Test
    void rejectsWrongWidthAndOutOfRangeTargets() {
        ScoringModel model = ScoringModel.initialize(new Random(1), 0.1);
        var mismatch = assertThrows(DimensionMismatchException.class, () -> scorer.predict(model, new double[5]));
        assertEquals(ScoringModel.INPUT_NODES, mismatch.expected());
        assertEquals(5, mismatch.actual());
        assertThrows(DimensionMismatchException.class, () -> scorer.train(model, new double[30], 1.0));
        assertThrows(IllegalArgumentException.class, () -> scorer.train(model, input(0.2), 1.5));
    }
}
