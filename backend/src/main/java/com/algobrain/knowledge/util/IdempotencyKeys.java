package com.algobrain.knowledge.util;

import com.algobrain.knowledge.model.CandidateFact;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;

/**
 * 幂等键生成（SHA-256，64 位十六进制）
 *
 * 断言：(sourceId, 主语, 谓词, 宾语, observedAt)；主语/宾语使用描述身份而非图谱ID，
 * 因此同一事实在实体合并前后重复投递仍然命中同一个键
 */
public final class IdempotencyKeys {

    private static final String SEP = "\u001F";

    private IdempotencyKeys() {
    }

    public static String forFact(CandidateFact fact) {
        String object = fact.hasEntityObject()
            ? fact.getObject().identityKey()
            : "lit:" + fact.getObjectLiteral();
        return digest("A", fact.getSourceId(), fact.getSubject().identityKey(), fact.getPredicate(),
            object, epoch(fact.getObservedAt()));
    }

    /**
     * 人工修正：同一审核任务的同一修正内容只写入一次
     */
    public static String forCorrection(String originalAssertionId, CandidateFact corrected) {
        return digest("C", originalAssertionId, forFact(corrected));
    }

    /**
     * 事件：(sourceId, 类型, 起止时间, 参与者身份)
     */
    public static String forEvent(String sourceId, String eventType, Instant start, Instant end,
                                  List<String> participantKeys) {
        return digest("E", sourceId, eventType, epoch(start), epoch(end), String.join(",", participantKeys));
    }

    private static String epoch(Instant instant) {
        return instant == null ? "" : String.valueOf(instant.toEpochMilli());
    }

    private static String digest(String... parts) {
        String joined = String.join(SEP, parts);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(joined.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
