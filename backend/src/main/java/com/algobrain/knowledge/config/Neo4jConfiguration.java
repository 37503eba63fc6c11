package com.algobrain.knowledge.config;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PreDestroy;
import java.util.concurrent.TimeUnit;

/**
 * Neo4j 图数据库配置
 *
 * 仅在 graph.neo4j.enabled=true 时生效；启动时连接失败直接报错，不静默降级
 */
@Configuration
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "true", matchIfMissing = false)
public class Neo4jConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jConfiguration.class);

    @Value("${graph.neo4j.uri:bolt://localhost:7687}")
    private String uri;

    @Value("${graph.neo4j.username:neo4j}")
    private String username;

    @Value("${graph.neo4j.password:password}")
    private String password;

    /** 单次事务超时，超时后写入失败进入重试 */
    @Value("${graph.neo4j.transaction-timeout-ms:5000}")
    private long transactionTimeoutMs;

    /** 入库线程池与查询接口共用连接池 */
    @Value("${graph.neo4j.max-pool-size:50}")
    private int maxPoolSize;

    private Driver driver;

    @Bean
    public Driver neo4jDriver() {
        logger.info("🔌 正在连接Neo4j图数据库: {}", uri);

        try {
            Config config = Config.builder()
                .withConnectionTimeout(transactionTimeoutMs, TimeUnit.MILLISECONDS)
                .withMaxTransactionRetryTime(transactionTimeoutMs, TimeUnit.MILLISECONDS)
                .withMaxConnectionPoolSize(maxPoolSize)
                .build();
            driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password), config);

            driver.verifyConnectivity();
            logger.info("✅ Neo4j图数据库连接成功 (pool={}, timeout={}ms)，断言与事件日志将持久化保存",
                maxPoolSize, transactionTimeoutMs);

        } catch (Exception e) {
            logger.error("❌ Neo4j连接失败: {}", e.getMessage());
            logger.error("   请检查：1) Neo4j服务是否启动 2) 端口7687是否开放 3) 用户名密码是否正确");
            logger.error("   如需降级为内存存储，请设置 graph.neo4j.enabled=false");
            throw new RuntimeException("Neo4j连接失败", e);
        }

        return driver;
    }

    @PreDestroy
    public void cleanup() {
        if (driver != null) {
            logger.info("🔌 关闭Neo4j连接");
            driver.close();
        }
    }
}
