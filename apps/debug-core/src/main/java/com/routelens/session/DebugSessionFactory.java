package com.routelens.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.audit.AuditTrailBuilder;
import com.routelens.config.ReplayProperties;
import com.routelens.recorder.DebugRecorder;
import com.routelens.replay.DatabaseDataLoader;
import com.routelens.replay.DynamicReplayEngine;
import com.routelens.replay.ToolCallExtractor;
import com.routelens.storage.RecordStore;
import com.routelens.util.PayloadSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/** 会话和回放引擎的入口；每个请求一个会话，每次回放一个引擎 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DebugSessionFactory {

    private final RecordStore store;
    private final PayloadSanitizer sanitizer;
    private final ObjectMapper om;
    private final DatabaseDataLoader loader;
    private final ToolCallExtractor extractor;
    private final ReplayProperties replayProps;
    private final Clock clock = Clock.systemUTC();

    public DebugSession openSession() {
        SessionContext ctx = SessionContext.open(clock.instant());
        DebugRecorder recorder = new DebugRecorder(ctx, store, sanitizer, om, clock);
        AuditTrailBuilder audit = new AuditTrailBuilder(ctx, store, sanitizer, om, clock);
        log.info("[SESSION] opened {}", ctx.sessionId());
        return new DebugSession(ctx, recorder, audit, store, loader, clock);
    }

    public DynamicReplayEngine newReplayEngine() {
        return new DynamicReplayEngine(loader, extractor, store, replayProps, clock);
    }
}
