package com.routelens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "debug.recorder")
public class RecorderProperties {

    /** 敏感字段被替换成的固定标记 */
    private String redactionMarker = "[REDACTED]";

    /**
     * 敏感字段名的正则（大小写不敏感，find 语义）。
     * key 只匹配后缀：apiKey / api_key / x-api-key，不误伤 keyword 之类。
     */
    private List<String> sensitivePatterns = List.of(
            "password", "secret", "token", "key$", "auth", "credential", "bearer");

    /**
     * 用量计数字段（整名匹配，大小写不敏感）不算凭据：max_tokens / prompt_tokens / maxTokens。
     * 名字里带 auth、secret、access 之类的字段即使匹配也照样脱敏。
     */
    private String usageCountPattern =
            "^(max|max_completion|max_output|prompt|completion|total|input|output|reasoning|cached)[_-]?tokens$";
}
