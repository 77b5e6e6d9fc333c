package com.routelens.replay.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ReplayedToolCall(String toolCallId, String toolName, String resultSource, JsonNode result) {}
