package com.example.hybridrec.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.hybridrec.dto.StrategyCtrRow;
import com.example.hybridrec.entity.RecommendationFeedback;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 推荐反馈 Mapper - 曝光/点击聚合查询
 */
@Mapper
public interface RecommendationFeedbackMapper extends BaseMapper<RecommendationFeedback> {

    /**
     * 最近一次对该资源的曝光
     */
    @Select("SELECT * FROM recommendation_feedback WHERE user_id = #{userId} AND resource_id = #{resourceId} " +
            "ORDER BY recommended_at DESC, id DESC LIMIT 1")
    RecommendationFeedback findLatest(@Param("userId") String userId, @Param("resourceId") String resourceId);

    /**
     * 按策略标签统计曝光与点击
     */
    @Select("SELECT recommendation_strategy AS strategy, COUNT(*) AS impressions, " +
            "SUM(CASE WHEN was_clicked = TRUE THEN 1 ELSE 0 END) AS clicks " +
            "FROM recommendation_feedback WHERE user_id = #{userId} AND recommended_at >= #{since} " +
            "GROUP BY recommendation_strategy")
    List<StrategyCtrRow> aggregateByStrategy(@Param("userId") String userId, @Param("since") LocalDateTime since);
}
