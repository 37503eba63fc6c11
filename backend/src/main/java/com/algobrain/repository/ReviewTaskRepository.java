package com.algobrain.repository;

import com.algobrain.domain.entity.ReviewTask;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface ReviewTaskRepository extends BaseMapper<ReviewTask> {

    /**
     * 队首：置信度升序，同置信度先入先出
     */
    @Select("SELECT * FROM kb_review_tasks WHERE status = 'OPEN' " +
            "ORDER BY priority ASC, enqueued_at ASC, id ASC LIMIT #{limit}")
    List<ReviewTask> findPendingHead(@Param("limit") int limit);

    /**
     * 游标之后的待审核任务，排序与 findPendingHead 一致
     */
    @Select("SELECT * FROM kb_review_tasks WHERE status = 'OPEN' AND (" +
            " priority > #{priority}" +
            " OR (priority = #{priority} AND enqueued_at > #{enqueuedAt})" +
            " OR (priority = #{priority} AND enqueued_at = #{enqueuedAt} AND id > #{id})) " +
            "ORDER BY priority ASC, enqueued_at ASC, id ASC LIMIT #{limit}")
    List<ReviewTask> findPendingAfter(@Param("priority") double priority,
                                      @Param("enqueuedAt") LocalDateTime enqueuedAt,
                                      @Param("id") long id,
                                      @Param("limit") int limit);

    @Select("SELECT * FROM kb_review_tasks WHERE assertion_id = #{assertionId}")
    ReviewTask findByAssertionId(@Param("assertionId") String assertionId);

    @Select("SELECT COUNT(*) FROM kb_review_tasks WHERE status = 'OPEN'")
    long countOpen();

    /**
     * 条件更新认领任务，返回 0 表示已被其他审核人处理
     */
    @Update("UPDATE kb_review_tasks SET status = 'RESOLVED', resolution = #{resolution}, " +
            "reviewer = #{reviewer}, note = #{note}, resolved_at = #{resolvedAt}, updated_at = #{resolvedAt} " +
            "WHERE id = #{id} AND status = 'OPEN'")
    int claimResolution(@Param("id") long id,
                        @Param("resolution") ReviewTask.ReviewDecision resolution,
                        @Param("reviewer") String reviewer,
                        @Param("note") String note,
                        @Param("resolvedAt") LocalDateTime resolvedAt);

    @Update("UPDATE kb_review_tasks SET corrected_assertion_id = #{correctedAssertionId} WHERE id = #{id}")
    int attachCorrection(@Param("id") long id, @Param("correctedAssertionId") String correctedAssertionId);

    /**
     * 落库失败时撤销认领
     */
    @Update("UPDATE kb_review_tasks SET status = 'OPEN', resolution = NULL, reviewer = NULL, note = NULL, " +
            "resolved_at = NULL WHERE id = #{id}")
    int reopen(@Param("id") long id);
}
