package com.algobrain.knowledge.model;

import lombok.Value;

import java.util.List;

/**
 * 待审核队列分页；nextCursor 为空表示没有更多
 */
@Value
public class ReviewPage {
    List<ReviewItem> items;
    String nextCursor;
    long totalOpen;
}
