package com.algobrain.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;

/**
 * 审核裁定请求；EDIT 时 correctedFact 必填
 */
@Data
public class ReviewDecisionRequest {

    /** ACCEPT / REJECT / EDIT */
    @NotBlank(message = "decision不能为空")
    private String decision;

    private RawCandidateFact correctedFact;

    private String reviewer;

    private String note;
}
