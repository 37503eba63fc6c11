package com.algobrain.knowledge.service.graph;

import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * 图数据库初始化服务
 *
 * 应用启动时创建唯一约束和索引；原子创建与幂等写入依赖这些唯一约束
 */
@Service
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "true")
public class GraphInitializationService {

    private static final Logger logger = LoggerFactory.getLogger(GraphInitializationService.class);

    static final String[] CONSTRAINTS = {
        "CREATE CONSTRAINT kb_entity_id IF NOT EXISTS FOR (e:KbEntity) REQUIRE e.entityId IS UNIQUE",
        "CREATE CONSTRAINT kb_entity_creation_key IF NOT EXISTS FOR (e:KbEntity) REQUIRE e.creationKey IS UNIQUE",
        "CREATE CONSTRAINT assertion_id IF NOT EXISTS FOR (a:Assertion) REQUIRE a.assertionId IS UNIQUE",
        "CREATE CONSTRAINT assertion_idempotency IF NOT EXISTS FOR (a:Assertion) REQUIRE a.idempotencyKey IS UNIQUE",
        "CREATE CONSTRAINT timeline_event_id IF NOT EXISTS FOR (ev:TimelineEvent) REQUIRE ev.eventId IS UNIQUE",
        "CREATE CONSTRAINT timeline_event_idempotency IF NOT EXISTS FOR (ev:TimelineEvent) REQUIRE ev.idempotencyKey IS UNIQUE",
        "CREATE CONSTRAINT kb_sequence_name IF NOT EXISTS FOR (s:KbSequence) REQUIRE s.name IS UNIQUE"
    };

    static final String[] INDEXES = {
        "CREATE INDEX kb_entity_external_id IF NOT EXISTS FOR (e:KbEntity) ON (e.externalId)",
        "CREATE INDEX kb_entity_normalized_name IF NOT EXISTS FOR (e:KbEntity) ON (e.normalizedName)",
        "CREATE INDEX kb_entity_merged_into IF NOT EXISTS FOR (e:KbEntity) ON (e.mergedInto)",
        "CREATE INDEX assertion_status IF NOT EXISTS FOR (a:Assertion) ON (a.validationStatus)",
        "CREATE INDEX assertion_resolved_at IF NOT EXISTS FOR (a:Assertion) ON (a.resolvedAt)",
        "CREATE INDEX timeline_event_effective IF NOT EXISTS FOR (ev:TimelineEvent) ON (ev.effectiveTime)"
    };

    @Autowired
    private Driver driver;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeGraph() {
        logger.info("🔧 开始初始化Neo4j证据库...");

        try (Session session = driver.session()) {
            logger.info("📌 创建唯一性约束...");
            runAll(session, CONSTRAINTS);
            logger.info("📌 创建索引...");
            runAll(session, INDEXES);
            logger.info("✅ Neo4j证据库初始化完成");
        } catch (Exception e) {
            logger.error("❌ Neo4j初始化失败", e);
        }
    }

    private void runAll(Session session, String[] statements) {
        for (String statement : statements) {
            try {
                session.run(statement).consume();
                logger.info("✓ {}", statement.split(" IF NOT EXISTS")[0].replace("CREATE ", ""));
            } catch (Exception e) {
                // 旧版本Neo4j可能已有同名约束
                logger.warn("约束/索引创建失败: {} -> {}", statement, e.getMessage());
            }
        }
    }
}
