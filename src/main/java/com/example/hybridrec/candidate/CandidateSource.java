package com.example.hybridrec.candidate;

import com.example.hybridrec.ranking.RankingWeights;

/**
 * 候选召回来源，value 同时是对应的分量名
 */
public enum CandidateSource {
    COLLABORATIVE(RankingWeights.COLLABORATIVE),
    CONTENT(RankingWeights.CONTENT),
    GRAPH(RankingWeights.GRAPH);

    private final String value;

    CandidateSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
