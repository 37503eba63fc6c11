package com.algobrain.knowledge.model;

import com.algobrain.domain.entity.ReviewTask;
import lombok.Value;

/**
 * 待审核条目：审核任务及其断言
 */
@Value
public class ReviewItem {
    ReviewTask task;
    Assertion assertion;
}
