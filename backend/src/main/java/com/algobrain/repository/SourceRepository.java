package com.algobrain.repository;

import com.algobrain.domain.entity.Source;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface SourceRepository extends BaseMapper<Source> {

    @Select("SELECT * FROM kb_sources ORDER BY source_id ASC")
    List<Source> findAllOrdered();

    /**
     * 只更新可信度相关字段
     */
    @Update("UPDATE kb_sources SET reliability_score = #{score}, resolved_count = #{resolvedCount}, " +
            "last_recomputed_at = #{recomputedAt}, updated_at = #{recomputedAt} WHERE source_id = #{sourceId}")
    int updateReliability(@Param("sourceId") String sourceId,
                          @Param("score") double score,
                          @Param("resolvedCount") int resolvedCount,
                          @Param("recomputedAt") LocalDateTime recomputedAt);
}
