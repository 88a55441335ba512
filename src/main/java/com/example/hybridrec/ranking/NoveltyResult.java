package com.example.hybridrec.ranking;

import com.example.hybridrec.candidate.Candidate;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Set;

@Data
@Builder
public class NoveltyResult {

    private List<Candidate> items;

    /**
     * 候选池中浏览量前 1/4 的资源
     */
    private Set<String> topViewedIds;

    /**
     * 是否有候选获得加成或被替换进入结果
     */
    private boolean applied;
}
