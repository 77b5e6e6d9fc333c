package com.routelens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "debug.replay")
public class ReplayProperties {
    private double defaultSpeed = 1.0;
    private double minSpeed = 0.1;
    private double maxSpeed = 10.0;

    /** 默认是否按录制时的间隔回放 */
    private boolean preserveTimestamp = true;

    /** 单步最长等待；0 表示不设上限，按录制间隔原样回放 */
    private Duration maxDelay = Duration.ZERO;

    /** 识别工具调用的容器字段（启发式，可按 provider 扩展） */
    private List<String> toolCallFields = List.of("tool_calls", "toolCalls", "tools", "function_calls");

    /** 识别工具结果的容器字段 */
    private List<String> toolResultFields = List.of("tool_results", "toolResults", "results", "tool_call_results");
}
