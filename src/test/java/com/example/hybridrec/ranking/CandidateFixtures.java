package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import com.example.hybridrec.dto.ResourceMetadata;

import java.util.ArrayList;
import java.util.List;

final class CandidateFixtures {

    private CandidateFixtures() {
    }

    static Candidate scored(String id, double hybridScore, double... embedding) {
        Candidate c = new Candidate(id);
        c.setHybridScore(hybridScore);
        if (embedding.length > 0) {
            List<Double> values = new ArrayList<>();
            for (double v : embedding) {
                values.add(v);
            }
            c.setMetadata(ResourceMetadata.builder().resourceId(id).embedding(values).build());
        }
        return c;
    }

    static Candidate viewed(String id, double hybridScore, long views) {
        Candidate c = new Candidate(id);
        c.setHybridScore(hybridScore);
        c.setViewCount(views);
        return c;
    }
}
