package com.algobrain.repository;

import com.algobrain.domain.entity.IngestionJob;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface IngestionJobRepository extends BaseMapper<IngestionJob> {

    @Select("SELECT * FROM kb_ingestion_jobs ORDER BY started_at DESC LIMIT #{limit}")
    List<IngestionJob> findRecent(@Param("limit") int limit);
}
