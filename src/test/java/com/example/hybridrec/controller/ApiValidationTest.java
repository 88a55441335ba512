package com.example.hybridrec.controller;

import com.example.hybridrec.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
public class ApiValidationTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void tracksValidInteraction() throws Exception {
        String body = "{\"userId\":\"" + newUserId() + "\",\"resourceId\":\"paper-1\","
            + "\"interactionType\":\"annotation\"}";

        mockMvc.perform(post("/api/interactions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.interactionStrength").value(0.7))
            .andExpect(jsonPath("$.returnVisits").value(0));
    }

    @Test
    void rejectsUnknownInteractionType() throws Exception {
        String body = "{\"userId\":\"" + newUserId() + "\",\"resourceId\":\"paper-1\","
            + "\"interactionType\":\"like\"}";

        mockMvc.perform(post("/api/interactions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_interaction_type"))
            .andExpect(jsonPath("$.field").value("interactionType"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void rejectsMissingUserId() throws Exception {
        String body = "{\"resourceId\":\"paper-1\",\"interactionType\":\"view\"}";

        mockMvc.perform(post("/api/interactions").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_failed"))
            .andExpect(jsonPath("$.field").value("userId"));
    }

    @Test
    void rejectsZeroLimit() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("userId", newUserId()).param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_failed"));
    }

    @Test
    void rejectsUnknownStrategy() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("userId", newUserId()).param("strategy", "popular"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_strategy"))
            .andExpect(jsonPath("$.field").value("strategy"));
    }

    @Test
    void rejectsProfileDiversityOutOfRange() throws Exception {
        String body = "{\"userId\":\"" + newUserId() + "\",\"diversityPreference\":1.5}";

        mockMvc.perform(put("/api/profile").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field").value("diversityPreference"));
    }

    @Test
    void returnsEmptyRecommendationsForNewUser() throws Exception {
        mockMvc.perform(get("/api/recommendations").param("userId", newUserId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.recommendations").isEmpty())
            .andExpect(jsonPath("$.metadata.coldStart").value(true));
    }
}
