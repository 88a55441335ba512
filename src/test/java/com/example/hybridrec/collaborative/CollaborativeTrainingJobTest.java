package com.example.hybridrec.collaborative;

import com.example.hybridrec.config.RecommendationProperties;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.service.DistributedLockService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class CollaborativeTrainingJobTest {

    @TempDir
    Path tempDir;

    private UserInteractionMapper interactionMapper;
    private DistributedLockService lockService;
    private CollaborativeScorer scorer;
    private CollaborativeTrainingJob job;
    private Path modelPath;

    @BeforeEach
    void setUp() {
        RecommendationProperties properties = CollaborativeModelTrainerTest.smallModelProperties();
        properties.getCollaborative().setEpochs(20);
        modelPath = tempDir.resolve("nested/ncf.json");
        properties.getCollaborative().setModelPath(modelPath.toString());

        ObjectMapper objectMapper = new ObjectMapper();
        interactionMapper = mock(UserInteractionMapper.class);
        lockService = mock(DistributedLockService.class);
        scorer = new CollaborativeScorer(properties, objectMapper);
        job = new CollaborativeTrainingJob(interactionMapper, new CollaborativeModelTrainer(properties),
            scorer, lockService, properties, objectMapper);
    }

    @SuppressWarnings("unchecked")
    private void lockAvailable(boolean available) {
        when(lockService.executeWithLock(anyString(), any(Supplier.class), any())).thenAnswer(invocation ->
            available ? ((Supplier<Object>) invocation.getArgument(1)).get() : invocation.getArgument(2));
    }

    @Test
    void trainsPersistsAndPublishes() {
        lockAvailable(true);
        List<UserInteraction> positives = CollaborativeModelTrainerTest.disjointPositives();
        when(interactionMapper.findAllPositive()).thenReturn(positives);
        when(interactionMapper.selectList(any())).thenReturn(positives);
        when(interactionMapper.findAllResourceIds()).thenReturn(CollaborativeModelTrainerTest.VOCABULARY);

        assertTrue(job.trainNow());

        assertTrue(Files.exists(modelPath));
        assertTrue(scorer.isAvailable());
        assertTrue(scorer.predict("u1", "i4").isAvailable());
    }

    @Test
    void nothingToTrainKeepsScorerUnavailable() {
        lockAvailable(true);
        when(interactionMapper.findAllPositive()).thenReturn(List.of());
        when(interactionMapper.selectList(any())).thenReturn(List.of());
        when(interactionMapper.findAllResourceIds()).thenReturn(List.of());

        assertFalse(job.trainNow());
        assertFalse(scorer.isAvailable());
        assertFalse(Files.exists(modelPath));
    }

    @Test
    void skipsWhenAnotherNodeIsTraining() {
        lockAvailable(false);

        assertFalse(job.trainNow());
        verify(interactionMapper, never()).findAllPositive();
    }
}
