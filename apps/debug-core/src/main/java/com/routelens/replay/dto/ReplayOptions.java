package com.routelens.replay.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/** 单次回放的参数 */
@Value
@Builder(toBuilder = true)
public class ReplayOptions {

    /** 从时间线第几步开始（0 起） */
    @Builder.Default
    int replayFromStep = 0;

    /** 只回放这些层；null 表示全部 */
    Set<String> onlyReplayLayers;

    /** 按录制时的间隔等待 */
    @Builder.Default
    boolean preserveTimestamp = true;

    /** 只使用录制数据（目前唯一支持的模式，保留字段用于状态展示） */
    @Builder.Default
    boolean strictDataMode = true;

    public static ReplayOptions defaults() {
        return ReplayOptions.builder().build();
    }

    public boolean includesLayer(String layer) {
        return onlyReplayLayers == null || onlyReplayLayers.contains(layer);
    }
}
