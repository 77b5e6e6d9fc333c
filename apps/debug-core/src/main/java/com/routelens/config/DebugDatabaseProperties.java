package com.routelens.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "debug.database")
public class DebugDatabaseProperties {
    /** 录制数据库根目录，默认放在用户目录下 */
    private String rootPath = System.getProperty("user.home") + "/.route-claudecode/database";

    /** 是否格式化输出 JSON（便于人工排查） */
    private boolean prettyPrint = true;
}
