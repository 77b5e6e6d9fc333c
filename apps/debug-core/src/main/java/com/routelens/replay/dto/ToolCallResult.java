package com.routelens.replay.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** 在录制库里找到的工具结果，附带来源文件和时间 */
public record ToolCallResult(JsonNode result, String sourceFile, String timestamp) {}
