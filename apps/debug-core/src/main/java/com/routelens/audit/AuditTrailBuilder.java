package com.routelens.audit;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.audit.dto.AuditQuery;
import com.routelens.audit.dto.AuditSummary;
import com.routelens.audit.dto.AuditSummary.FlowOperation;
import com.routelens.audit.dto.AuditSummary.LayerFlow;
import com.routelens.audit.dto.AuditSummary.LayerSequenceEntry;
import com.routelens.audit.dto.AuditSummary.LayerStats;
import com.routelens.audit.dto.AuditSummary.PerformanceStats;
import com.routelens.audit.dto.AuditSummary.TransformationStats;
import com.routelens.audit.dto.DataFlowEntry;
import com.routelens.audit.dto.Lineage;
import com.routelens.audit.dto.SessionAuditFile;
import com.routelens.audit.dto.Trace;
import com.routelens.audit.dto.TraceQueryResult;
import com.routelens.audit.dto.TraceStatus;
import com.routelens.audit.dto.TransformationAnalysis;
import com.routelens.audit.dto.TransformationRecord;
import com.routelens.error.InvalidStateException;
import com.routelens.error.NotFoundException;
import com.routelens.session.SessionContext;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import com.routelens.util.PayloadSanitizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单会话审计链：维护 trace 因果树，检测每层是否改写了数据，计算血缘和统计。
 *
 * 节点存在 traceId -> Trace 表里，父子只存 id；所有递归遍历都带 visited 集合，
 * 数据被写坏成环也不会死循环。同一会话内不同 trace 可以并发记录。
 */
@Slf4j
public class AuditTrailBuilder {

    private final SessionContext session;
    private final RecordStore store;
    private final PayloadSanitizer sanitizer;
    private final ObjectMapper om;
    private final Clock clock;

    /** traceId -> Trace，唯一的共享可变结构 */
    private final Map<String, Trace> traces = new ConcurrentHashMap<>();
    private final List<LayerSequenceEntry> layerSequence = new CopyOnWriteArrayList<>();
    private final List<TransformationRecord> transformations = new CopyOnWriteArrayList<>();

    /** 保护 trace 字段修改、children 追加和会话文件改写 */
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionAuditFile.IndexEntry> traceabilityIndex = new LinkedHashMap<>();
    private final AtomicLong snapshotSeq = new AtomicLong();

    public AuditTrailBuilder(SessionContext session, RecordStore store, PayloadSanitizer sanitizer,
                             ObjectMapper om, Clock clock) {
        this.session = session;
        this.store = store;
        this.sanitizer = sanitizer;
        this.om = om;
        this.clock = clock;
        writeSessionFile();
    }

    public String sessionId() {
        return session.sessionId();
    }

    // ---------- trace 生命周期 ----------

    public String startLayerTrace(String layer, String operation, Object inputData) {
        return startLayerTrace(layer, operation, inputData, null);
    }

    public String startLayerTrace(String layer, String operation, Object inputData, String parentTraceId) {
        String traceId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        JsonNode input = sanitizer.sanitize(inputData);

        Trace trace = new Trace();
        trace.setTraceId(traceId);
        trace.setSessionId(session.sessionId());
        trace.setLayer(layer);
        trace.setOperation(operation);
        trace.setTimestamp(now.toString());
        trace.setParentTraceId(parentTraceId);
        trace.setInputData(input);
        trace.setStatus(TraceStatus.STARTED);
        trace.getMetadata().put(Trace.META_INPUT_SIZE, sanitizer.sizeOf(input));
        trace.getMetadata().put(Trace.META_START_TIME, now.toEpochMilli());

        Trace traceSnapshot;
        lock.lock();
        try {
            traces.put(traceId, trace);
            layerSequence.add(new LayerSequenceEntry(layer, operation, traceId, trace.getTimestamp(), parentTraceId));
            if (parentTraceId != null && !linkChild(parentTraceId, traceId)) {
                log.warn("[AUDIT] parent trace {} unknown, {} recorded as detached", parentTraceId, traceId);
            }
            traceSnapshot = trace.copy();
        } finally {
            lock.unlock();
        }

        persistTrace(traceSnapshot);
        log.debug("[AUDIT] trace started {} {}-{} parent={}", traceId, layer, operation, parentTraceId);
        return traceId;
    }

    public Trace completeLayerTrace(String traceId, Object outputData, TraceStatus status) {
        return completeLayerTrace(traceId, outputData, status, Map.of());
    }

    public Trace completeLayerTrace(String traceId, Object outputData, TraceStatus status, Map<String, ?> metrics) {
        if (status == null || !status.isTerminal()) {
            throw new InvalidStateException("Completion status must be success, error or warning, got " + status);
        }
        JsonNode output = sanitizer.sanitize(outputData);
        Map<String, Object> extra = toMap(sanitizer.sanitize(metrics == null ? Map.of() : metrics));

        Trace snapshot;
        lock.lock();
        try {
            Trace trace = traces.get(traceId);
            if (trace == null) {
                throw NotFoundException.trace(traceId);
            }
            if (trace.isComplete()) {
                throw new InvalidStateException("Trace " + traceId + " already completed with status " + trace.getStatus().wire());
            }
            Instant end = clock.instant();
            long startMs = ((Number) trace.getMetadata().get(Trace.META_START_TIME)).longValue();

            // 调用方指标不能覆盖计时字段
            extra.keySet().removeAll(List.of(Trace.META_START_TIME, Trace.META_END_TIME,
                    Trace.META_DURATION, Trace.META_INPUT_SIZE, Trace.META_OUTPUT_SIZE));
            trace.getMetadata().putAll(extra);

            trace.setOutputData(output);
            trace.setStatus(status);
            trace.setEndTime(end.toString());
            trace.getMetadata().put(Trace.META_END_TIME, end.toEpochMilli());
            trace.getMetadata().put(Trace.META_DURATION, end.toEpochMilli() - startMs);
            trace.getMetadata().put(Trace.META_OUTPUT_SIZE, sanitizer.sizeOf(output));
            snapshot = trace.copy();
        } finally {
            lock.unlock();
        }

        persistTrace(snapshot);
        if (TransformationClassifier.hasTransformation(om, snapshot.getInputData(), snapshot.getOutputData())) {
            recordTransformation(traceId, snapshot.getInputData(), snapshot.getOutputData(), snapshot.getLayer());
        }
        log.debug("[AUDIT] trace completed {} status={} duration={}ms", traceId, status.wire(), snapshot.getDuration());
        return snapshot;
    }

    public String recordTransformation(String traceId, Object inputData, Object outputData, String layer) {
        String transformationId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        JsonNode input = sanitizer.sanitize(inputData);
        JsonNode output = sanitizer.sanitize(outputData);
        TransformationAnalysis analysis = TransformationClassifier.analyze(om, input, output);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("inputSize", sanitizer.sizeOf(input));
        metadata.put("outputSize", sanitizer.sizeOf(output));

        TransformationRecord record = new TransformationRecord(
                transformationId, traceId, session.sessionId(), now.toString(), layer,
                input, output, analysis, metadata);
        store.writeRecord(Namespace.TRANSFORMATIONS, "transform-" + transformationId, record);
        transformations.add(record);

        lock.lock();
        try {
            traceabilityIndex.put(transformationId,
                    new SessionAuditFile.IndexEntry(traceId, layer, record.timestamp()));
            writeSessionFile();
        } finally {
            lock.unlock();
        }
        log.debug("[AUDIT] transformation {} on trace {} type={}", transformationId, traceId, analysis.type().wire());
        return transformationId;
    }

    /**
     * 在 parent 的 children 末尾追加 child 并重写 parent 的 trace 文件。
     * 只校验 parent 存在，不检查环；血缘遍历自己防环。
     */
    boolean linkChild(String parentTraceId, String childTraceId) {
        Trace parentSnapshot;
        lock.lock();
        try {
            Trace parent = traces.get(parentTraceId);
            if (parent == null) return false;
            parent.getChildren().add(childTraceId);
            parentSnapshot = parent.copy();
        } finally {
            lock.unlock();
        }
        persistTrace(parentSnapshot);
        return true;
    }

    // ---------- 血缘 ----------

    public Lineage buildDataLineage(String traceId) {
        List<DataFlowEntry> dataFlow = new ArrayList<>();
        Set<String> subtree = new LinkedHashSet<>();
        long totalDuration = 0;

        lock.lock();
        try {
            if (!traces.containsKey(traceId)) {
                throw NotFoundException.trace(traceId);
            }
            // 前序 DFS，visited 防环
            Deque<String> stack = new ArrayDeque<>();
            stack.push(traceId);
            while (!stack.isEmpty()) {
                String id = stack.pop();
                if (!subtree.add(id)) continue;
                Trace t = traces.get(id);
                if (t == null) {
                    subtree.remove(id);
                    continue;
                }
                dataFlow.add(new DataFlowEntry(t.getTraceId(), t.getLayer(), t.getOperation(), t.getTimestamp(), t.getStatus()));
                Long d = t.getDuration();
                if (d != null) totalDuration += d;
                List<String> children = t.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    String child = children.get(i);
                    if (!subtree.contains(child)) stack.push(child);
                }
            }
        } finally {
            lock.unlock();
        }

        List<TransformationRecord> related = transformations.stream()
                .filter(r -> subtree.contains(r.traceId()))
                .toList();
        List<String> layers = new ArrayList<>(dataFlow.stream()
                .map(DataFlowEntry::layer)
                .collect(LinkedHashSet::new, LinkedHashSet::add, LinkedHashSet::addAll));

        Instant now = clock.instant();
        Lineage lineage = new Lineage(
                traceId,
                session.sessionId(),
                now.toString(),
                dataFlow,
                related,
                layers,
                new Lineage.Metadata(layers.size(), related.size(), totalDuration)
        );
        store.writeRecord(Namespace.LINEAGE,
                "lineage-" + traceId + "-" + now.toEpochMilli() + "-" + snapshotSeq.incrementAndGet(), lineage);
        return lineage;
    }

    // ---------- 查询与汇总 ----------

    public List<TraceQueryResult> queryAuditTrail(AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        List<Trace> matches = new ArrayList<>();
        lock.lock();
        try {
            for (Trace t : traces.values()) {
                if (matches(t, q)) matches.add(t.copy());
            }
        } finally {
            lock.unlock();
        }

        Comparator<Trace> cmp = q.getSortBy() == AuditQuery.SortKey.DURATION
                ? Comparator.comparingLong((Trace t) -> t.getDuration() == null ? 0L : t.getDuration())
                : Comparator.comparing((Trace t) -> parseInstant(t.getTimestamp()),
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));
        if (q.getDirection() == AuditQuery.Direction.DESC) {
            cmp = cmp.reversed();
        }
        matches.sort(cmp);

        List<TraceQueryResult> out = new ArrayList<>(matches.size());
        for (Trace t : matches) {
            out.add(new TraceQueryResult(t, q.isIncludeLineage() ? buildDataLineage(t.getTraceId()) : null));
        }
        return out;
    }

    public Optional<Trace> getTrace(String traceId) {
        lock.lock();
        try {
            Trace t = traceId == null ? null : traces.get(traceId);
            return Optional.ofNullable(t == null ? null : t.copy());
        } finally {
            lock.unlock();
        }
    }

    public AuditSummary getAuditSummary() {
        List<Trace> snapshot = new ArrayList<>();
        lock.lock();
        try {
            traces.values().forEach(t -> snapshot.add(t.copy()));
        } finally {
            lock.unlock();
        }
        snapshot.sort(Comparator.comparing(Trace::getTimestamp, Comparator.nullsFirst(Comparator.<String>naturalOrder())));

        AuditSummary summary = new AuditSummary(
                session.sessionId(),
                snapshot.size(),
                List.copyOf(layerSequence),
                layerStats(snapshot),
                transformationStats(),
                performanceStats(snapshot),
                dataFlowMap(snapshot),
                clock.instant().toString()
        );
        store.writeRecord(Namespace.AUDIT, "audit-summary-" + session.sessionId(), summary);
        return summary;
    }

    // ---------- 内部 ----------

    private boolean matches(Trace t, AuditQuery q) {
        if (q.getLayer() != null && !q.getLayer().equals(t.getLayer())) return false;
        if (q.getOperation() != null && !q.getOperation().equals(t.getOperation())) return false;
        if (q.getStatus() != null && q.getStatus() != t.getStatus()) return false;
        Instant ts = parseInstant(t.getTimestamp());
        if (q.getStartTime() != null && (ts == null || ts.isBefore(q.getStartTime()))) return false;
        if (q.getEndTime() != null && (ts == null || ts.isAfter(q.getEndTime()))) return false;
        return true;
    }

    private static Map<String, LayerStats> layerStats(List<Trace> traces) {
        Map<String, int[]> counts = new LinkedHashMap<>();   // total, success, error, warning
        Map<String, Long> durations = new LinkedHashMap<>();
        for (Trace t : traces) {
            int[] c = counts.computeIfAbsent(t.getLayer(), k -> new int[4]);
            c[0]++;
            if (t.getStatus() == TraceStatus.SUCCESS) c[1]++;
            if (t.getStatus() == TraceStatus.ERROR) c[2]++;
            if (t.getStatus() == TraceStatus.WARNING) c[3]++;
            Long d = t.getDuration();
            durations.merge(t.getLayer(), d == null ? 0L : d, Long::sum);
        }
        Map<String, LayerStats> out = new LinkedHashMap<>();
        counts.forEach((layer, c) -> {
            long total = durations.getOrDefault(layer, 0L);
            out.put(layer, new LayerStats(c[0], c[1], c[2], c[3], c[0] > 0 ? (double) total / c[0] : 0, total));
        });
        return out;
    }

    private TransformationStats transformationStats() {
        Map<String, Integer> byLayer = new LinkedHashMap<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        long totalSize = 0;
        List<TransformationRecord> all = List.copyOf(transformations);
        for (TransformationRecord r : all) {
            byLayer.merge(r.layer(), 1, Integer::sum);
            byType.merge(r.transformation().type().wire(), 1, Integer::sum);
            Object out = r.metadata().get("outputSize");
            if (out instanceof Number n) totalSize += n.longValue();
        }
        return new TransformationStats(all.size(), byLayer, byType, all.isEmpty() ? 0 : (double) totalSize / all.size());
    }

    private static PerformanceStats performanceStats(List<Trace> traces) {
        long total = 0;
        int count = 0;
        for (Trace t : traces) {
            Long d = t.getDuration();
            if (d != null) {
                total += d;
                count++;
            }
        }
        return new PerformanceStats(count, total, count > 0 ? (double) total / count : 0, 1);
    }

    private static Map<String, LayerFlow> dataFlowMap(List<Trace> traces) {
        Map<String, Trace> byId = new LinkedHashMap<>();
        traces.forEach(t -> byId.put(t.getTraceId(), t));

        Map<String, List<FlowOperation>> ops = new LinkedHashMap<>();
        Map<String, Set<String>> parents = new LinkedHashMap<>();
        Map<String, Set<String>> children = new LinkedHashMap<>();
        for (Trace t : traces) {
            String layer = t.getLayer();
            ops.computeIfAbsent(layer, k -> new ArrayList<>())
                    .add(new FlowOperation(t.getTraceId(), t.getOperation(), t.getTimestamp()));
            parents.computeIfAbsent(layer, k -> new LinkedHashSet<>());
            children.computeIfAbsent(layer, k -> new LinkedHashSet<>());
            Trace parent = t.getParentTraceId() == null ? null : byId.get(t.getParentTraceId());
            if (parent != null) {
                parents.get(layer).add(parent.getLayer());
            }
            for (String childId : t.getChildren()) {
                Trace child = byId.get(childId);
                if (child != null) children.get(layer).add(child.getLayer());
            }
        }
        Map<String, LayerFlow> out = new LinkedHashMap<>();
        ops.forEach((layer, list) -> out.put(layer, new LayerFlow(
                list, new ArrayList<>(parents.get(layer)), new ArrayList<>(children.get(layer)))));
        return out;
    }

    private void persistTrace(Trace trace) {
        store.writeRecord(Namespace.TRACES, "trace-" + trace.getTraceId(), trace);
    }

    /** 调用方需持有 lock（构造函数除外） */
    private void writeSessionFile() {
        SessionAuditFile file = new SessionAuditFile(
                session.sessionId(),
                session.startTime().toString(),
                clock.instant().toString(),
                traces.size(),
                traceabilityIndex.size(),
                new LinkedHashMap<>(traceabilityIndex)
        );
        store.writeRecord(Namespace.SESSIONS, "session-" + session.sessionId(), file);
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) return new LinkedHashMap<>();
        return om.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static Instant parseInstant(String s) {
        if (s == null) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
