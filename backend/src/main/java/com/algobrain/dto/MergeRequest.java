package com.algobrain.dto;

import lombok.Data;

import javax.validation.constraints.NotBlank;

@Data
public class MergeRequest {

    @NotBlank(message = "losingEntityId不能为空")
    private String losingEntityId;

    @NotBlank(message = "survivingEntityId不能为空")
    private String survivingEntityId;

    private String reason;
}
