package com.algobrain;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * AlgoBrain 知识库入库引擎主应用类
 *
 * @author AlgoBrain
 * @version 1.0.0
 * @since 2025-06-01
 */
@SpringBootApplication
@MapperScan("com.algobrain.repository")
@EnableAsync
@EnableScheduling
public class AlgoBrainApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlgoBrainApplication.class, args);
        System.out.println("🚀 AlgoBrain 入库引擎启动成功");
        System.out.println("📚 访问地址: http://localhost:8080/api");
    }
}
