package com.algobrain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceRegistrationRequest {

    @NotBlank(message = "sourceId不能为空")
    private String sourceId;

    private String displayName;

    /** STRUCTURED_FEED / LLM_EXTRACTION / CODE_ANALYSIS / MANUAL */
    private String sourceKind;
}
