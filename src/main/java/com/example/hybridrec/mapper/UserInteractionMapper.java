package com.example.hybridrec.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.hybridrec.entity.UserInteraction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户交互 Mapper
 */
@Mapper
public interface UserInteractionMapper extends BaseMapper<UserInteraction> {

    @Select("SELECT * FROM user_interaction WHERE user_id = #{userId} AND resource_id = #{resourceId}")
    UserInteraction findByUserAndResource(@Param("userId") String userId, @Param("resourceId") String resourceId);

    /**
     * 最近的正向交互（按交互时间倒序）
     */
    @Select("SELECT * FROM user_interaction WHERE user_id = #{userId} AND is_positive = TRUE " +
            "ORDER BY interaction_timestamp DESC, id DESC LIMIT #{limit}")
    List<UserInteraction> findRecentPositive(@Param("userId") String userId, @Param("limit") int limit);

    /**
     * 指定时间之后的正向交互（偏好学习窗口）
     */
    @Select("SELECT * FROM user_interaction WHERE user_id = #{userId} AND is_positive = TRUE " +
            "AND interaction_timestamp >= #{since} ORDER BY interaction_timestamp DESC, id DESC LIMIT #{limit}")
    List<UserInteraction> findPositiveSince(@Param("userId") String userId,
                                            @Param("since") LocalDateTime since,
                                            @Param("limit") int limit);

    /**
     * 最近交互过的资源（图召回种子）
     */
    @Select("SELECT resource_id FROM user_interaction WHERE user_id = #{userId} " +
            "ORDER BY interaction_timestamp DESC, id DESC LIMIT #{limit}")
    List<String> findRecentResourceIds(@Param("userId") String userId, @Param("limit") int limit);

    @Select("SELECT resource_id FROM user_interaction WHERE user_id = #{userId}")
    List<String> findResourceIdsByUser(@Param("userId") String userId);

    /**
     * 全量正向交互（离线训练用）
     */
    @Select("SELECT * FROM user_interaction WHERE is_positive = TRUE")
    List<UserInteraction> findAllPositive();

    @Select("SELECT DISTINCT resource_id FROM user_interaction")
    List<String> findAllResourceIds();
}
