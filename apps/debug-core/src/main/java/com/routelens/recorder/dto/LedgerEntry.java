package com.routelens.recorder.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** 会话账本里的一行：指向落盘记录，不复制数据 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(
        String recordId,
        String layer,
        String operation,
        String timestamp,
        String filePath
) {}
