package com.routelens.recorder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.routelens.recorder.dto.IoOperation;
import com.routelens.recorder.dto.LayerIORecord;
import com.routelens.recorder.dto.LedgerEntry;
import com.routelens.recorder.dto.PerformanceRecord;
import com.routelens.recorder.dto.ReplayScenario;
import com.routelens.recorder.dto.SessionSummary;
import com.routelens.session.SessionContext;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import com.routelens.util.JsonCanonicalizer;
import com.routelens.util.PayloadSanitizer;
import com.routelens.util.SystemSnapshots;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 单会话录制器：
 *  - recordLayerIO:           每层输入/输出/错误各落一个文件，并记入会话账本
 *  - recordPerformanceMetrics: 耗时 + 进程资源快照
 *  - createReplayScenario:    从账本挑记录组成回放场景
 *  - getSessionSummary:       交给审计链 / 回放引擎的摘要
 *
 * 写盘失败直接抛出，不重试。
 */
@Slf4j
public class DebugRecorder {

    private final SessionContext session;
    private final RecordStore store;
    private final PayloadSanitizer sanitizer;
    private final ObjectMapper om;
    private final Clock clock;

    /** 会话账本（按写入顺序） */
    private final List<LedgerEntry> ledger = new CopyOnWriteArrayList<>();
    private final Map<String, LedgerEntry> ledgerById = new ConcurrentHashMap<>();

    public DebugRecorder(SessionContext session, RecordStore store, PayloadSanitizer sanitizer,
                         ObjectMapper om, Clock clock) {
        this.session = session;
        this.store = store;
        this.sanitizer = sanitizer;
        this.om = om;
        this.clock = clock;
    }

    public String sessionId() {
        return session.sessionId();
    }

    public String recordLayerIO(String layer, IoOperation operation, Object data, Map<String, ?> metadata) {
        return recordLayerIO(layer, operation.wire(), data, metadata);
    }

    public String recordLayerIO(String layer, String operation, Object data, Map<String, ?> metadata) {
        String recordId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        JsonNode sanitized = sanitizer.sanitize(data);
        ObjectNode meta = om.createObjectNode();
        JsonNode callerMeta = sanitizer.sanitize(metadata);
        if (callerMeta.isObject()) {
            meta.setAll((ObjectNode) callerMeta);
        }
        meta.put("dataSize", sanitizer.sizeOf(sanitized));
        meta.put("dataHash", JsonCanonicalizer.fingerprint(om, sanitized));

        LayerIORecord record = new LayerIORecord(
                recordId, session.sessionId(), now.toString(), layer, operation, sanitized, meta);
        Path file = store.writeRecord(Namespace.LAYERS,
                layer + "-" + operation + "-" + recordId + "-" + now.toEpochMilli(), record);

        LedgerEntry entry = new LedgerEntry(recordId, layer, operation, now.toString(), file.toString());
        ledger.add(entry);
        ledgerById.put(recordId, entry);

        log.debug("[RECORDER] {}-{} recorded id={} size={}", layer, operation, recordId, meta.get("dataSize"));
        return recordId;
    }

    public String recordPerformanceMetrics(String layer, String operation, long startTime, long endTime,
                                           Map<String, ?> metrics) {
        String recordId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        PerformanceRecord record = new PerformanceRecord(
                recordId,
                session.sessionId(),
                now.toString(),
                layer,
                operation,
                startTime,
                endTime,
                Math.max(0, endTime - startTime),
                SystemSnapshots.capture(),
                sanitizer.sanitize(metrics == null ? Map.of() : metrics)
        );
        store.writeRecord(Namespace.PERFORMANCE, "perf-" + layer + "-" + recordId + "-" + now.toEpochMilli(), record);
        log.debug("[RECORDER] perf {}-{} duration={}ms", layer, operation, record.duration());
        return recordId;
    }

    /** 用整本账创建场景 */
    public String createReplayScenario(String name) {
        return createReplayScenario(name, ledger.stream().map(LedgerEntry::recordId).toList());
    }

    public String createReplayScenario(String name, List<String> recordIds) {
        String scenarioId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        List<LedgerEntry> refs = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (String id : recordIds) {
            LedgerEntry e = ledgerById.get(id);
            if (e == null) {
                unresolved.add(id);
            } else {
                refs.add(e);
            }
        }
        if (!unresolved.isEmpty()) {
            log.warn("[RECORDER] scenario '{}' skipped {} unknown record ids: {}", name, unresolved.size(), unresolved);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalRecords", refs.size());
        metadata.put("layersInvolved", new ArrayList<>(refs.stream()
                .map(LedgerEntry::layer)
                .collect(LinkedHashSet::new, LinkedHashSet::add, LinkedHashSet::addAll)));
        metadata.put("unresolvedRecordIds", unresolved);

        ReplayScenario scenario = new ReplayScenario(
                scenarioId, name, session.sessionId(), now.toString(), refs, metadata);
        Path file = store.writeRecord(Namespace.REPLAY, "scenario-" + name + "-" + now.toEpochMilli(), scenario);

        log.info("[RECORDER] scenario '{}' created: id={} records={} file={}",
                name, scenarioId, refs.size(), file.getFileName());
        return scenarioId;
    }

    public Optional<LedgerEntry> lookup(String recordId) {
        return Optional.ofNullable(recordId == null ? null : ledgerById.get(recordId));
    }

    public List<LedgerEntry> ledger() {
        return List.copyOf(ledger);
    }

    public SessionSummary getSessionSummary() {
        List<LedgerEntry> snapshot = List.copyOf(ledger);
        return new SessionSummary(
                session.sessionId(),
                session.startTime().toString(),
                clock.instant().toString(),
                snapshot,
                snapshot.size()
        );
    }
}
