package com.routelens.replay.dto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** 回放引擎对外发出的事件，按回放顺序发出 */
public record ReplayEvent(ReplayEventType type, String replayId, String sessionId, String ts, Map<String, Object> data) {

    public static ReplayEvent of(ReplayEventType type, String replayId, String sessionId, Instant at,
                                 Map<String, Object> data) {
        return new ReplayEvent(type, replayId, sessionId, at.toString(), data == null ? Map.of() : data);
    }

    public static ReplayEvent error(String replayId, String sessionId, Instant at, Throwable t) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", formatThrowable(t));
        data.put("type", t == null ? null : t.getClass().getSimpleName());
        return new ReplayEvent(ReplayEventType.REPLAY_ERROR, replayId, sessionId, at.toString(), data);
    }

    private static String formatThrowable(Throwable t) {
        if (t == null) return "<null>";
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) msg = t.toString();
        Throwable c = t.getCause();
        if (c != null && c != t) msg += " | cause: " + c;
        return msg;
    }
}
