package com.algobrain.knowledge.service.similarity;

import com.algobrain.knowledge.config.EngineConfig;
import com.algobrain.knowledge.exception.RetryableResolutionFailure;
import com.algobrain.knowledge.model.GraphEntity;
import com.algobrain.knowledge.model.SimilarityHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部向量相似度服务客户端
 *
 * POST {base-url}/nearest {text, k} -> [{entityId, score}]
 * POST {base-url}/index {entityId, text}
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "similarity.enabled", havingValue = "true")
public class HttpSimilarityService implements SimilarityService {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    @Autowired
    public HttpSimilarityService(EngineConfig engineConfig,
                                 @Value("${similarity.base-url:http://localhost:8000}") String baseUrl) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(engineConfig.getSimilarityTimeoutMs());
        requestFactory.setReadTimeout(engineConfig.getSimilarityTimeoutMs());
        this.restTemplate = new RestTemplate(requestFactory);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        log.info("🔌 相似度服务: {} (超时 {}ms)", this.baseUrl, engineConfig.getSimilarityTimeoutMs());
    }

    HttpSimilarityService(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public List<SimilarityHit> nearest(String text, int k) {
        Map<String, Object> body = new HashMap<>();
        body.put("text", text);
        body.put("k", k);
        try {
            SimilarityHit[] hits = restTemplate.postForObject(baseUrl + "/nearest", jsonEntity(body),
                SimilarityHit[].class);
            return hits == null ? List.of() : Arrays.asList(hits);
        } catch (RestClientException e) {
            log.warn("相似度服务调用失败: {}", e.getMessage());
            throw new RetryableResolutionFailure("相似度服务调用失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void index(GraphEntity entity) {
        Map<String, Object> body = new HashMap<>();
        body.put("entityId", entity.getEntityId());
        body.put("text", entity.getDescription() == null
            ? entity.getCanonicalName()
            : entity.getCanonicalName() + " " + entity.getDescription());
        try {
            restTemplate.postForObject(baseUrl + "/index", jsonEntity(body), String.class);
        } catch (RestClientException e) {
            // 索引失败只影响召回，不阻断入库
            log.warn("相似度索引登记失败: entityId={}, {}", entity.getEntityId(), e.getMessage());
        }
    }

    private HttpEntity<Map<String, Object>> jsonEntity(Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }
}
