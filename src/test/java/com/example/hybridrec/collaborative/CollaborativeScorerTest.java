package com.example.hybridrec.collaborative;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.entity.UserInteraction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CollaborativeScorerTest {

    @TempDir
    Path tempDir;

    private RecommendationProperties properties;
    private ObjectMapper objectMapper;
    private CollaborativeScorer scorer;
    private NcfModelSnapshot snapshot;

    @BeforeEach
    void setUp() {
        properties = CollaborativeModelTrainerTest.smallModelProperties();
        properties.getCollaborative().setEpochs(50);
        properties.getCollaborative().setModelPath(tempDir.resolve("model.json").toString());
        objectMapper = new ObjectMapper();
        scorer = new CollaborativeScorer(properties, objectMapper);

        List<UserInteraction> positives = CollaborativeModelTrainerTest.disjointPositives();
        snapshot = new CollaborativeModelTrainer(properties).train(
            positives, CollaborativeModelTrainerTest.seenOf(positives), CollaborativeModelTrainerTest.VOCABULARY);
    }

    @Test
    void untrainedModelIsUnavailable() {
        scorer.init();

        assertFalse(scorer.isAvailable());
        assertFalse(scorer.predict("u1", "i1").isAvailable());
        assertTrue(scorer.topItems("u1", Set.of(), 10).isEmpty());
        assertThrows(IllegalStateException.class, () -> scorer.predict("u1", "i1").getValue());
    }

    @Test
    void unknownUserOrItemIsUnavailable() {
        scorer.swap(NcfModel.fromSnapshot(snapshot));

        assertTrue(scorer.predict("u1", "i1").isAvailable());
        assertFalse(scorer.predict("stranger", "i1").isAvailable());
        assertFalse(scorer.predict("u1", "unknown-item").isAvailable());

        Map<String, CollaborativeScore> batch = scorer.predictBatch("u1", List.of("i1", "unknown-item"));
        assertTrue(batch.get("i1").isAvailable());
        assertFalse(batch.get("unknown-item").isAvailable());
    }

    @Test
    void topItemsExcludesSeenAndOrdersByScore() {
        scorer.swap(NcfModel.fromSnapshot(snapshot));

        Map<String, Double> top = scorer.topItems("u1", Set.of("i1", "i2"), 3);

        assertEquals(3, top.size());
        assertFalse(top.containsKey("i1"));
        assertFalse(top.containsKey("i2"));
        List<Double> scores = List.copyOf(top.values());
        for (int i = 1; i < scores.size(); i++) {
            assertTrue(scores.get(i - 1) >= scores.get(i));
        }
    }

    @Test
    void reloadsPersistedSnapshot() throws Exception {
        objectMapper.writeValue(tempDir.resolve("model.json").toFile(), snapshot);

        assertTrue(scorer.reload());
        assertTrue(scorer.isAvailable());
        assertEquals(NcfModel.fromSnapshot(snapshot).predict("u2", "i5"),
            scorer.predict("u2", "i5").getValue(), 1e-12);
    }

    @Test
    void corruptSnapshotKeepsCurrentModel() throws Exception {
        scorer.swap(NcfModel.fromSnapshot(snapshot));
        Files.writeString(tempDir.resolve("model.json"), "{\"embeddingDim\": 8, \"userIds\": [\"u1\"]}");

        assertFalse(scorer.reload());
        assertTrue(scorer.predict("u1", "i1").isAvailable());
    }

    @Test
    void snapshotWithNullLayerLeavesScorerUnavailable() throws Exception {
        NcfModelSnapshot broken = NcfModel.fromSnapshot(snapshot).toSnapshot();
        broken.setWeights(new double[][][]{null});
        broken.setBiases(new double[][]{null});
        objectMapper.writeValue(tempDir.resolve("model.json").toFile(), broken);

        scorer.init();

        assertFalse(scorer.isAvailable());
        assertFalse(scorer.predict("u1", "i1").isAvailable());
    }
}
