package com.algobrain.knowledge.model;

import lombok.Value;

/**
 * 修正数据集导出条目
 */
@Value
public class ExportRecord {
    String sourceTextRef;
    Assertion assertion;
}
