package com.routelens.replay.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolCallDescriptor(String id, String name, JsonNode args, String type) {}
