package com.routelens.replay.dto;

public record ReplayError(int step, String interaction, String error, String timestamp) {}
