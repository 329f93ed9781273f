package com.vulcorpus.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 启用 corpus.* 配置绑定
 * JSON 解析使用 Spring Boot 自动配置的 ObjectMapper；CSV 读写各自持有 CsvMapper，
 * 不注册为 Bean，否则会替换掉自动配置的 ObjectMapper
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@Configuration
@EnableConfigurationProperties(CorpusProperties.class)
public class CorpusConfig {
}
