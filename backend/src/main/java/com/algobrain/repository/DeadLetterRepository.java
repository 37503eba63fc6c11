package com.algobrain.repository;

import com.algobrain.domain.entity.DeadLetterRecord;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface DeadLetterRepository extends BaseMapper<DeadLetterRecord> {

    @Select("SELECT * FROM kb_dead_letters WHERE status = 'PARKED' ORDER BY id ASC")
    List<DeadLetterRecord> findParked();

    @Select("SELECT * FROM kb_dead_letters WHERE job_id = #{jobId} ORDER BY id ASC")
    List<DeadLetterRecord> findByJobId(@Param("jobId") String jobId);

    @Select("SELECT COUNT(*) FROM kb_dead_letters WHERE status = 'PARKED'")
    long countParked();
}
