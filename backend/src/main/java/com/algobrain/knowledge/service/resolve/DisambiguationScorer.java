package com.algobrain.knowledge.service.resolve;

import com.algobrain.knowledge.model.EntityDescriptor;
import com.algobrain.knowledge.model.ResolutionCandidate;
import com.algobrain.knowledge.model.ResolutionContext;

/**
 * 消歧打分策略，返回 [0,1]
 */
public interface DisambiguationScorer {

    double score(EntityDescriptor descriptor, ResolutionCandidate candidate, ResolutionContext context);
}
