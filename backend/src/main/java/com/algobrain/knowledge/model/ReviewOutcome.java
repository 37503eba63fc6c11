package com.algobrain.knowledge.model;

import com.algobrain.domain.entity.ReviewTask;
import lombok.Value;

/**
 * 审核裁定结果
 */
@Value
public class ReviewOutcome {
    Long taskId;
    ReviewTask.ReviewDecision decision;
    /** 裁定后的原断言 */
    Assertion assertion;
    /** EDIT 时新写入的修正断言 */
    Assertion correctedAssertion;
}
