package com.algobrain.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量入库请求
 */
@Data
public class IngestionRequest {

    /** 来源登记信息，已登记的来源可只填 sourceId */
    private SourceRegistrationRequest source;

    private List<RawCandidateFact> facts = new ArrayList<>();

    private List<RawEvent> events = new ArrayList<>();
}
