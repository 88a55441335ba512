package com.example.hybridrec.collaborative;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.exception.ModelUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CollaborativeModelTrainerTest {

    static final List<String> VOCABULARY = List.of("i1", "i2", "i3", "i4", "i5", "i6");

    private CollaborativeModelTrainer trainer;

    @BeforeEach
    void setUp() {
        trainer = new CollaborativeModelTrainer(smallModelProperties());
    }

    static RecommendationProperties smallModelProperties() {
        RecommendationProperties properties = new RecommendationProperties();
        RecommendationProperties.Collaborative config = properties.getCollaborative();
        config.setEmbeddingDim(8);
        config.setHiddenLayers(new ArrayList<>(List.of(16, 8)));
        config.setNegativeRatio(2);
        config.setEpochs(300);
        config.setLearningRate(0.05);
        config.setSeed(7L);
        return properties;
    }

    static List<UserInteraction> disjointPositives() {
        List<UserInteraction> positives = new ArrayList<>();
        for (String item : List.of("i1", "i2", "i3")) {
            positives.add(positive("u1", item));
        }
        for (String item : List.of("i4", "i5", "i6")) {
            positives.add(positive("u2", item));
        }
        return positives;
    }

    static Map<String, Set<String>> seenOf(List<UserInteraction> interactions) {
        Map<String, Set<String>> seen = new HashMap<>();
        for (UserInteraction i : interactions) {
            seen.computeIfAbsent(i.getUserId(), k -> new HashSet<>()).add(i.getResourceId());
        }
        return seen;
    }

    @Test
    void learnsDisjointPreferences() {
        List<UserInteraction> positives = disjointPositives();
        NcfModel model = NcfModel.fromSnapshot(trainer.train(positives, seenOf(positives), VOCABULARY));

        double u1Own = avg(model, "u1", "i1", "i2", "i3");
        double u1Other = avg(model, "u1", "i4", "i5", "i6");
        double u2Own = avg(model, "u2", "i4", "i5", "i6");
        double u2Other = avg(model, "u2", "i1", "i2", "i3");

        assertTrue(u1Own > u1Other, "u1 own=" + u1Own + ", other=" + u1Other);
        assertTrue(u2Own > u2Other, "u2 own=" + u2Own + ", other=" + u2Other);
    }

    @Test
    void sameSeedGivesSameModel() {
        List<UserInteraction> positives = disjointPositives();
        NcfModelSnapshot first = trainer.train(positives, seenOf(positives), VOCABULARY);
        NcfModelSnapshot second = trainer.train(positives, seenOf(positives), VOCABULARY);

        assertEquals(first.getFinalLoss(), second.getFinalLoss());
        assertArrayEquals(first.getUserEmbeddings()[0], second.getUserEmbeddings()[0]);
        assertEquals(first.getTrainingSamples(), second.getTrainingSamples());
    }

    @Test
    void noPositivesMeansNoModel() {
        assertThrows(ModelUnavailableException.class, () -> trainer.train(List.of(), Map.of(), VOCABULARY));
    }

    @Test
    void predictionsAreProbabilities() {
        List<UserInteraction> positives = disjointPositives();
        NcfModel model = NcfModel.fromSnapshot(trainer.train(positives, seenOf(positives), VOCABULARY));

        for (String item : VOCABULARY) {
            double p = model.predict("u1", item);
            assertTrue(p > 0.0 && p < 1.0, item + " -> " + p);
        }
    }

    private static double avg(NcfModel model, String user, String... items) {
        double sum = 0.0;
        for (String item : items) {
            sum += model.predict(user, item);
        }
        return sum / items.length;
    }

    private static UserInteraction positive(String user, String item) {
        return UserInteraction.builder()
            .userId(user)
            .resourceId(item)
            .interactionStrength(0.8)
            .isPositive(true)
            .build();
    }
}
