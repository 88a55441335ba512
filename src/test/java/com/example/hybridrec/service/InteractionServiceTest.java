package com.example.hybridrec.service;

import com.example.hybridrec.IntegrationTestSupport;
import com.example.hybridrec.dto.InteractionContext;
import com.example.hybridrec.dto.ResourceMetadata;
import com.example.hybridrec.entity.InteractionType;
import com.example.hybridrec.entity.UserInteraction;
import com.example.hybridrec.entity.UserProfile;
import com.example.hybridrec.exception.InvalidInteractionTypeException;
import com.example.hybridrec.mapper.UserInteractionMapper;
import com.example.hybridrec.mapper.UserProfileMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class InteractionServiceTest extends IntegrationTestSupport {

    @Autowired
    private InteractionService interactionService;

    @Autowired
    private UserInteractionMapper interactionMapper;

    @Autowired
    private UserProfileMapper profileMapper;

    @Autowired
    private UserProfileService profileService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    void repeatedInteractionIsDeduplicated() {
        String userId = newUserId();

        UserInteraction first = interactionService.trackInteraction(userId, "res-1", "annotation", null);
        assertEquals(0, first.getReturnVisits());

        interactionService.trackInteraction(userId, "res-1", "annotation", null);

        UserInteraction stored = interactionMapper.findByUserAndResource(userId, "res-1");
        assertEquals(1, interactionMapper.findResourceIdsByUser(userId).size());
        assertEquals(1, stored.getReturnVisits());
        assertEquals(0.7, stored.getInteractionStrength(), 1e-9);
        assertTrue(stored.getIsPositive());
        assertEquals(2, profileMapper.findByUserId(userId).getTotalInteractions());
    }

    @Test
    void strengthIsNeverLowered() {
        String userId = newUserId();

        interactionService.trackInteraction(userId, "res-1", "annotation", null);
        interactionService.trackInteraction(userId, "res-1", "view",
            InteractionContext.builder().dwellTime(5).build());

        UserInteraction stored = interactionMapper.findByUserAndResource(userId, "res-1");
        assertEquals(0.7, stored.getInteractionStrength(), 1e-9);
        assertEquals("annotation", stored.getInteractionType());
        assertEquals(5, stored.getDwellTime());
        assertTrue(stored.getIsPositive());
    }

    @Test
    void viewStrengthFollowsDwellAndScroll() {
        double moderate = interactionService.computeStrength(InteractionType.VIEW,
            InteractionContext.builder().dwellTime(120).scrollDepth(0.5).build());
        double capped = interactionService.computeStrength(InteractionType.VIEW,
            InteractionContext.builder().dwellTime(10000).scrollDepth(1.0).build());
        double bare = interactionService.computeStrength(InteractionType.VIEW, InteractionContext.empty());

        assertEquals(0.27, moderate, 1e-9);
        assertEquals(0.5, capped, 1e-9);
        assertEquals(0.1, bare, 1e-9);
    }

    @Test
    void ratingStrengthAndConfidence() {
        String userId = newUserId();

        UserInteraction five = interactionService.trackInteraction(userId, "res-5", "rating",
            InteractionContext.builder().rating(5).build());
        UserInteraction unrated = interactionService.trackInteraction(userId, "res-x", "rating", null);

        assertEquals(1.0, five.getInteractionStrength(), 1e-9);
        assertEquals(1.0, five.getConfidence(), 1e-9);
        assertEquals(0.6, unrated.getInteractionStrength(), 1e-9);
        assertTrue(unrated.getIsPositive());
    }

    @Test
    void unknownTypeIsRejectedWithoutSideEffects() {
        String userId = newUserId();

        InvalidInteractionTypeException ex = assertThrows(InvalidInteractionTypeException.class,
            () -> interactionService.trackInteraction(userId, "res-1", "like", null));

        assertEquals("interactionType", ex.getField());
        assertNull(interactionMapper.findByUserAndResource(userId, "res-1"));
        assertNull(profileMapper.findByUserId(userId));
    }

    @Test
    void everyTenthInteractionLearnsAuthors() {
        String userId = newUserId();
        stubAuthors();

        for (int i = 0; i < 9; i++) {
            interactionService.trackInteraction(userId, "paper-" + i, "collection_add", null);
        }
        assertTrue(profileService.getPreferredAuthors(profileMapper.findByUserId(userId)).isEmpty());

        interactionService.trackInteraction(userId, "paper-9", "collection_add", null);

        UserProfile profile = profileMapper.findByUserId(userId);
        assertEquals(10, profile.getTotalInteractions());
        assertEquals(List.of("alice", "bob", "carol"), profileService.getPreferredAuthors(profile));
    }

    @Test
    void learningFailureKeepsInteractionAndPreviousAuthors() {
        String userId = newUserId();
        stubAuthors();
        for (int i = 0; i < 10; i++) {
            interactionService.trackInteraction(userId, "paper-" + i, "collection_add", null);
        }
        assertEquals(List.of("alice", "bob", "carol"),
            profileService.getPreferredAuthors(profileMapper.findByUserId(userId)));

        when(metadataClient.getMetadata(anyCollection()))
            .thenThrow(new IllegalStateException("metadata service down"));
        for (int i = 10; i < 20; i++) {
            String resourceId = "paper-" + i;
            UserInteraction stored = assertDoesNotThrow(
                () -> interactionService.trackInteraction(userId, resourceId, "collection_add", null));
            assertNotNull(stored.getId());
        }

        UserProfile profile = profileMapper.findByUserId(userId);
        assertEquals(20, profile.getTotalInteractions());
        assertNotNull(interactionMapper.findByUserAndResource(userId, "paper-19"));
        assertEquals(List.of("alice", "bob", "carol"), profileService.getPreferredAuthors(profile));
    }

    @Test
    void learningIsSkippedWhenInteractionWriteRollsBack() {
        String userId = newUserId();
        stubAuthors();

        transactionTemplate.executeWithoutResult(status -> {
            for (int i = 0; i < 10; i++) {
                interactionService.trackInteraction(userId, "paper-" + i, "collection_add", null);
            }
            status.setRollbackOnly();
        });

        verify(metadataClient, never()).getMetadata(anyCollection());
        assertNull(profileMapper.findByUserId(userId));
        assertNull(interactionMapper.findByUserAndResource(userId, "paper-9"));
    }

    private void stubAuthors() {
        when(metadataClient.getMetadata(anyCollection())).thenAnswer(invocation -> {
            Map<String, ResourceMetadata> result = new HashMap<>();
            for (Object id : invocation.<Collection<?>>getArgument(0)) {
                String resourceId = (String) id;
                int n = Integer.parseInt(resourceId.substring(resourceId.indexOf('-') + 1));
                List<String> authors;
                if (n < 3) {
                    authors = List.of("alice", "bob", "carol");
                } else if (n < 6) {
                    authors = List.of("alice", "bob");
                } else {
                    authors = List.of("alice");
                }
                result.put(resourceId, metadata(resourceId, "example.org", authors, 10, 1, 0, 0, 0));
            }
            return result;
        });
    }
}
