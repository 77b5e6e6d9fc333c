package com.routelens.recorder.dto;

import java.util.List;

/** 录制器交给审计链 / 回放引擎的会话摘要 */
public record SessionSummary(
        String sessionId,
        String startTime,
        String endTime,
        List<LedgerEntry> ledger,
        int recordCount
) {}
