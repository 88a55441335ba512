package com.example.hybridrec.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.example.hybridrec.entity.UserProfile;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

/**
 * 用户画像 Mapper
 */
@Mapper
public interface UserProfileMapper extends BaseMapper<UserProfile> {

    @Select("SELECT * FROM user_profile WHERE user_id = #{userId}")
    UserProfile findByUserId(@Param("userId") String userId);

    /**
     * 原子累加交互计数并刷新活跃时间
     */
    @Update("UPDATE user_profile SET total_interactions = total_interactions + 1, last_active_at = #{now}, updated_at = #{now} " +
            "WHERE user_id = #{userId}")
    int incrementInteractions(@Param("userId") String userId, @Param("now") LocalDateTime now);

    @Update("UPDATE user_profile SET preferred_authors = #{preferredAuthors}, updated_at = #{now} WHERE user_id = #{userId}")
    int updatePreferredAuthors(@Param("userId") String userId,
                               @Param("preferredAuthors") String preferredAuthors,
                               @Param("now") LocalDateTime now);
}
