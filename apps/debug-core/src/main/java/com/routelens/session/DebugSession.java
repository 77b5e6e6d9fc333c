package com.routelens.session;

import com.routelens.audit.AuditTrailBuilder;
import com.routelens.audit.dto.TraceStatus;
import com.routelens.error.DebugDataException;
import com.routelens.recorder.DebugRecorder;
import com.routelens.recorder.dto.IoOperation;
import com.routelens.recorder.dto.ReplayScenario;
import com.routelens.replay.DatabaseDataLoader;
import com.routelens.session.dto.DebugReport;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一个会话的调试句柄：持有同一个 SessionContext 下的录制器和审计链。
 * 由 {@link DebugSessionFactory#openSession()} 创建，用完 close()。
 */
@Slf4j
public class DebugSession implements AutoCloseable {

    private final SessionContext context;
    private final DebugRecorder recorder;
    private final AuditTrailBuilder auditTrail;
    private final RecordStore store;
    private final DatabaseDataLoader loader;
    private final Clock clock;

    private final AtomicInteger activeOperations = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public DebugSession(SessionContext context, DebugRecorder recorder, AuditTrailBuilder auditTrail,
                        RecordStore store, DatabaseDataLoader loader, Clock clock) {
        this.context = context;
        this.recorder = recorder;
        this.auditTrail = auditTrail;
        this.store = store;
        this.loader = loader;
        this.clock = clock;
    }

    public String sessionId() {
        return context.sessionId();
    }

    public DebugRecorder recorder() {
        return recorder;
    }

    public AuditTrailBuilder auditTrail() {
        return auditTrail;
    }

    public <T> T instrument(String layer, String method, Object input, Callable<T> call) throws Exception {
        return instrument(layer, method, input, null, call);
    }

    /**
     * 包住一次层调用：输入落盘 + 开 trace → 执行 → 输出（或错误）落盘 + 关 trace + 性能样本。
     * 调用本身的异常原样抛出；收尾时的存储异常挂在它的 suppressed 上。
     */
    public <T> T instrument(String layer, String method, Object input, String parentTraceId,
                            Callable<T> call) throws Exception {
        String operationId = layer + "-" + method + "-" + UUID.randomUUID();
        long start = clock.millis();

        Map<String, Object> inputMeta = new LinkedHashMap<>();
        inputMeta.put("method", method);
        inputMeta.put("operationId", operationId);
        String inputRecordId = recorder.recordLayerIO(layer, IoOperation.INPUT, input, inputMeta);
        String traceId = auditTrail.startLayerTrace(layer, method, input, parentTraceId);
        activeOperations.incrementAndGet();

        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", e.getMessage() == null ? e.toString() : e.getMessage());
            payload.put("type", e.getClass().getName());
            try {
                finish(layer, method, operationId, inputRecordId, traceId, start,
                        IoOperation.ERROR, payload, TraceStatus.ERROR, null);
            } catch (DebugDataException recordingFailure) {
                e.addSuppressed(recordingFailure);
            }
            throw e;
        }

        finish(layer, method, operationId, inputRecordId, traceId, start,
                IoOperation.OUTPUT, result, TraceStatus.SUCCESS, result);
        return result;
    }

    private void finish(String layer, String method, String operationId, String inputRecordId, String traceId,
                        long start, IoOperation op, Object payload, TraceStatus status, Object result) {
        try {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("method", method);
            meta.put("operationId", operationId);
            meta.put("inputRecordId", inputRecordId);
            meta.put("status", status.wire());
            recorder.recordLayerIO(layer, op, payload, meta);

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("operationId", operationId);
            auditTrail.completeLayerTrace(traceId, payload, status, metrics);

            Map<String, Object> perf = new LinkedHashMap<>();
            perf.put("status", status.wire());
            perf.put("resultType", result == null ? "null" : result.getClass().getSimpleName());
            recorder.recordPerformanceMetrics(layer, method, start, clock.millis(), perf);
            log.debug("[SESSION] {}-{} finished status={} trace={}", layer, method, status.wire(), traceId);
        } finally {
            activeOperations.decrementAndGet();
        }
    }

    public String createReplayScenario(String name) {
        return recorder.createReplayScenario(name);
    }

    public DebugReport.DebugStatus status() {
        return new DebugReport.DebugStatus(
                context.sessionId(),
                activeOperations.get(),
                Math.max(0, clock.millis() - context.startTime().toEpochMilli()),
                closed.get());
    }

    /** 录制摘要 + 审计汇总 + 本会话的场景，写入 sessions/debug-report-<sessionId>.json */
    public DebugReport generateDebugReport() {
        List<String> scenarios = loader.listScenarios().stream()
                .filter(s -> context.sessionId().equals(s.sessionId()))
                .map(ReplayScenario::scenarioName)
                .toList();
        DebugReport report = new DebugReport(
                context.sessionId(),
                clock.instant().toString(),
                status(),
                recorder.getSessionSummary(),
                auditTrail.getAuditSummary(),
                scenarios);
        Path file = store.writeRecord(Namespace.SESSIONS, "debug-report-" + context.sessionId(), report);
        log.info("[SESSION] debug report written: {}", file.getFileName());
        return report;
    }

    /** 写最终报告和账本索引；重复调用无效果 */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (activeOperations.get() > 0) {
            log.warn("[SESSION] closing session {} with {} operations still running",
                    context.sessionId(), activeOperations.get());
        }
        generateDebugReport();
        Path index = store.writeRecord(Namespace.INDEXES, "ledger-" + context.sessionId(), recorder.getSessionSummary());
        log.info("[SESSION] session {} closed, ledger index {}", context.sessionId(), index.getFileName());
    }
}
