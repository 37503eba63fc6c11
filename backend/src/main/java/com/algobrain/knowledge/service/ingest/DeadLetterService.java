package com.algobrain.knowledge.service.ingest;

import com.algobrain.domain.entity.DeadLetterRecord;
import com.algobrain.dto.RawCandidateFact;
import com.algobrain.dto.RawEvent;
import com.algobrain.knowledge.model.FactOutcome;
import com.algobrain.knowledge.model.FactResult;
import com.algobrain.repository.DeadLetterRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 死信管理：保存重试耗尽的原始输入，支持人工重放
 */
@Slf4j
@Service
public class DeadLetterService {

    public static final String PAYLOAD_FACT = "FACT";
    public static final String PAYLOAD_EVENT = "EVENT";

    private final DeadLetterRepository deadLetterRepository;
    private final FactIngestionService factIngestionService;
    private final ObjectMapper objectMapper;

    @Autowired
    public DeadLetterService(DeadLetterRepository deadLetterRepository,
                             FactIngestionService factIngestionService,
                             ObjectMapper objectMapper) {
        this.deadLetterRepository = deadLetterRepository;
        this.factIngestionService = factIngestionService;
        this.objectMapper = objectMapper;
    }

    public DeadLetterRecord parkFact(String jobId, RawCandidateFact fact, FactResult result) {
        return park(jobId, fact.getSourceId(), PAYLOAD_FACT, fact, result);
    }

    public DeadLetterRecord parkEvent(String jobId, RawEvent event, FactResult result) {
        return park(jobId, event.getSourceId(), PAYLOAD_EVENT, event, result);
    }

    private DeadLetterRecord park(String jobId, String sourceId, String payloadType, Object payload, FactResult result) {
        DeadLetterRecord record = new DeadLetterRecord();
        record.setJobId(jobId);
        record.setSourceId(sourceId);
        record.setPayloadType(payloadType);
        record.setPayload(toJson(payload));
        record.setFailureClass(result.getFailureClass());
        record.setLastError(result.getError());
        record.setAttempts(result.getAttempts());
        record.setStatus(DeadLetterRecord.DeadLetterStatus.PARKED);
        deadLetterRepository.insert(record);
        log.warn("📮 输入已转入死信: id={}, job={}, source={}, type={}, error={}",
            record.getId(), jobId, sourceId, payloadType, result.getError());
        return record;
    }

    public List<DeadLetterRecord> listParked() {
        return deadLetterRepository.findParked();
    }

    public List<DeadLetterRecord> listByJob(String jobId) {
        return deadLetterRepository.findByJobId(jobId);
    }

    public long countParked() {
        return deadLetterRepository.countParked();
    }

    /**
     * 重放死信；处理成功（含判定为重复）后标记为已重放，再次失败则保持原状
     */
    public FactResult replay(Long id) {
        DeadLetterRecord record = deadLetterRepository.selectById(id);
        if (record == null) {
            throw new NoSuchElementException("死信不存在: " + id);
        }
        if (record.getStatus() == DeadLetterRecord.DeadLetterStatus.REPLAYED) {
            throw new IllegalStateException("死信已重放: " + id);
        }

        FactResult result;
        if (PAYLOAD_EVENT.equals(record.getPayloadType())) {
            result = factIngestionService.ingestEvent(fromJson(record.getPayload(), RawEvent.class));
        } else {
            result = factIngestionService.ingestFact(fromJson(record.getPayload(), RawCandidateFact.class));
        }

        if (result.getOutcome() == FactOutcome.DEAD_LETTERED) {
            record.setAttempts(record.getAttempts() + result.getAttempts());
            record.setLastError(result.getError());
            record.setFailureClass(result.getFailureClass());
            deadLetterRepository.updateById(record);
            log.warn("死信重放仍然失败: id={}, error={}", id, result.getError());
            return result;
        }

        record.setStatus(DeadLetterRecord.DeadLetterStatus.REPLAYED);
        record.setReplayedAt(LocalDateTime.now());
        deadLetterRepository.updateById(record);
        log.info("✅ 死信重放完成: id={}, outcome={}", id, result.getOutcome());
        return result;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("死信序列化失败", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("死信内容无法解析", e);
        }
    }
}
