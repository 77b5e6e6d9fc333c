package com.routelens.session;

import java.time.Instant;
import java.util.UUID;

/**
 * 一次请求生命周期的会话句柄。录制器和审计链都持有同一个实例，
 * 不依赖任何全局可变状态。
 */
public record SessionContext(String sessionId, Instant startTime) {

    public static SessionContext open(Instant now) {
        return new SessionContext(UUID.randomUUID().toString(), now);
    }
}
