package com.example.hybridrec.client;

import com.example.hybridrec.dto.GraphNeighbor;
import com.example.hybridrec.dto.SimilarResource;
import com.example.hybridrec.vector.EmbeddingVector;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HttpCandidateClientsTest {

    private final EmbeddingVector query = EmbeddingVector.of(new double[]{1.0, 0.0}, 2);

    private static WebClient hanging() {
        return WebClient.builder().exchangeFunction(request -> Mono.never()).build();
    }

    private static WebClient returning(String json) {
        return WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build()))
            .build();
    }

    @Test
    void hangingSimilarityServiceReleasesCallerAfterTimeout() {
        HttpContentSimilarityClient client = new HttpContentSimilarityClient(hanging(), 100);

        long started = System.currentTimeMillis();
        List<SimilarResource> result = client.findSimilar(query, 10, 0.3);

        assertTrue(result.isEmpty());
        assertTrue(System.currentTimeMillis() - started < 2000);
    }

    @Test
    void hangingGraphServiceReleasesCallerAfterTimeout() {
        HttpGraphNeighborClient client = new HttpGraphNeighborClient(hanging(), 100);

        long started = System.currentTimeMillis();
        List<GraphNeighbor> result = client.findNeighbors(List.of("seed"), 2, 10);

        assertTrue(result.isEmpty());
        assertTrue(System.currentTimeMillis() - started < 2000);
    }

    @Test
    void parsesSimilarityResponse() {
        HttpContentSimilarityClient client = new HttpContentSimilarityClient(
            returning("[{\"resourceId\":\"r1\",\"similarity\":0.8,\"extra\":true}]"), 1000);

        List<SimilarResource> result = client.findSimilar(query, 10, 0.3);

        assertEquals(1, result.size());
        assertEquals("r1", result.get(0).getResourceId());
        assertEquals(0.8, result.get(0).getSimilarity(), 1e-12);
    }

    @Test
    void serverErrorDegradesToEmpty() {
        WebClient failing = WebClient.builder()
            .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build()))
            .build();
        HttpGraphNeighborClient client = new HttpGraphNeighborClient(failing, 1000);

        assertTrue(client.findNeighbors(List.of("seed"), 2, 10).isEmpty());
    }
}
