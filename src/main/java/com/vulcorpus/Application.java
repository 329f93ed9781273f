package com.vulcorpus;

import com.vulcorpus.config.CorpusProperties;
import com.vulcorpus.model.RunReport;
import com.vulcorpus.workflow.CorpusPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * 漏洞检测训练语料构建入口
 * 启动即按 corpus.* 配置执行一次流水线，失败时异常向上抛出，进程以非零码退出
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@SpringBootApplication
@Slf4j
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "corpus", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
    CommandLineRunner corpusPipelineRunner(CorpusPipeline pipeline, CorpusProperties properties) {
        return args -> {
            try {
                RunReport report = pipeline.run(properties);
                log.info("✅ 语料构建完成，共写出 {} 个切分", report.getOutputs().size());
            } catch (Exception e) {
                log.error("❌ 语料构建失败: {}", e.getMessage());
                throw e;
            }
        };
    }
}
