package com.routelens.audit.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** queryAuditTrail 的过滤条件，字段为 null 表示不过滤 */
@Value
@Builder
public class AuditQuery {

    public enum SortKey { TIMESTAMP, DURATION }

    public enum Direction { ASC, DESC }

    String layer;
    String operation;
    TraceStatus status;
    Instant startTime;
    Instant endTime;
    boolean includeLineage;

    @Builder.Default
    SortKey sortBy = SortKey.TIMESTAMP;

    @Builder.Default
    Direction direction = Direction.ASC;

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }
}
