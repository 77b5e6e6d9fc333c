package com.routelens.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.routelens.config.ReplayProperties;
import com.routelens.error.DebugDataException;
import com.routelens.error.InvalidStateException;
import com.routelens.error.NotFoundException;
import com.routelens.recorder.dto.LedgerEntry;
import com.routelens.recorder.dto.ReplayScenario;
import com.routelens.replay.dto.Interaction;
import com.routelens.replay.dto.InteractionResult;
import com.routelens.replay.dto.ReplayError;
import com.routelens.replay.dto.ReplayEvent;
import com.routelens.replay.dto.ReplayEventType;
import com.routelens.replay.dto.ReplayOptions;
import com.routelens.replay.dto.ReplayResult;
import com.routelens.replay.dto.ReplayState;
import com.routelens.replay.dto.ReplayStatus;
import com.routelens.replay.dto.ReplayedToolCall;
import com.routelens.replay.dto.ToolCallDescriptor;
import com.routelens.replay.dto.ToolCallMapping;
import com.routelens.replay.dto.ToolCallResult;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于录制库的回放引擎。一个实例对应一个 replayId，可以顺序跑多次回放，不能并发跑。
 *
 * 状态：idle → running → completed / error / stopped，running ⇄ paused。
 * pause / stop 在两步之间生效；按录制间隔等待时会被 pause / stop / setSpeed 唤醒。
 * 事件通过 {@link #events()} 按发生顺序推送，订阅方在回放线程上同步收到。
 */
@Slf4j
public class DynamicReplayEngine {

    static final String RESULT_SOURCE = "recorded-database";

    private final String replayId = UUID.randomUUID().toString();

    private final DatabaseDataLoader loader;
    private final ToolCallExtractor extractor;
    private final RecordStore store;
    private final ReplayProperties props;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();

    private volatile ReplayState state = ReplayState.IDLE;
    private volatile String currentSessionId;
    private volatile int currentStep;
    private volatile int totalSteps;
    private volatile double speed;
    private volatile ReplayOptions options;

    /** layer-operation -> 该组记录 */
    private final Map<String, List<LoadedRecord>> layerRecords = new ConcurrentHashMap<>();
    /** toolCallId -> 调用与录制结果 */
    private final Map<String, ToolCallMapping> toolCallResults = new ConcurrentHashMap<>();
    private volatile List<Interaction> timeline = List.of();

    /** 多播；emit 统一在 synchronized(sink) 里串行 */
    private final Sinks.Many<ReplayEvent> sink = Sinks.unsafe().many().multicast().onBackpressureBuffer(1024, false);

    public DynamicReplayEngine(DatabaseDataLoader loader, ToolCallExtractor extractor, RecordStore store,
                               ReplayProperties props, Clock clock) {
        this.loader = loader;
        this.extractor = extractor;
        this.store = store;
        this.props = props;
        this.clock = clock;
        this.speed = clampSpeed(props.getDefaultSpeed());
        this.options = ReplayOptions.builder().preserveTimestamp(props.isPreserveTimestamp()).build();
        log.info("[REPLAY] engine {} ready. speed={}, maxDelay={}", replayId, speed, props.getMaxDelay());
    }

    public String replayId() {
        return replayId;
    }

    // ---------- 事件 ----------

    public Flux<ReplayEvent> events() {
        return sink.asFlux();
    }

    /** 结束事件流；之后的回放事件不再推送 */
    public void shutdown() {
        stop();
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }

    private void emit(ReplayEventType type, Map<String, Object> data) {
        emit(ReplayEvent.of(type, replayId, currentSessionId, clock.instant(), data));
    }

    private void emit(ReplayEvent event) {
        synchronized (sink) {
            Sinks.EmitResult r = sink.tryEmitNext(event);
            if (r.isFailure()) {
                log.debug("[REPLAY] event {} not delivered: {}", event.type(), r);
            }
        }
    }

    // ---------- 回放 ----------

    public Mono<ReplayResult> startDynamicReplayAsync(String sessionId, ReplayOptions opts) {
        return Mono.fromCallable(() -> startDynamicReplay(sessionId, opts))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public ReplayResult startDynamicReplay(String sessionId) {
        return startDynamicReplay(sessionId, null);
    }

    /**
     * 同步回放整个会话。被 stop 的回放返回已完成部分，finalState=stopped。
     *
     * @throws NotFoundException    会话没有场景文件
     * @throws InvalidStateException 已有回放在进行
     */
    public ReplayResult startDynamicReplay(String sessionId, ReplayOptions opts) {
        lock.lock();
        try {
            if (state.isActive()) {
                throw new InvalidStateException("Replay " + replayId + " is already " + state.wire());
            }
            state = ReplayState.RUNNING;
            currentSessionId = sessionId;
            currentStep = 0;
            totalSteps = 0;
            options = opts == null ? ReplayOptions.builder().preserveTimestamp(props.isPreserveTimestamp()).build() : opts;
        } finally {
            lock.unlock();
        }

        log.info("[REPLAY] start replay {} session={} options={}", replayId, sessionId, options);
        Map<String, Object> startData = new LinkedHashMap<>();
        startData.put("sessionId", sessionId);
        emit(ReplayEventType.REPLAY_STARTED, startData);

        try {
            ReplayScenario scenario = loader.loadSessionData(sessionId)
                    .orElseThrow(() -> NotFoundException.session(sessionId));
            buildDataMappings(scenario);

            ReplayResult result = executeReplay();

            lock.lock();
            try {
                if (state != ReplayState.STOPPED) {
                    state = ReplayState.COMPLETED;
                }
                stateChanged.signalAll();
            } finally {
                lock.unlock();
            }
            result.setFinalState(state);
            saveResult(result);

            if (result.getFinalState() == ReplayState.COMPLETED) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("totalInteractions", result.getTotalInteractions());
                data.put("completedInteractions", result.getCompletedInteractions());
                data.put("toolCallsReplayed", result.getToolCallsReplayed());
                data.put("dataCoverageRate", result.getDataCoverageRate());
                emit(ReplayEventType.REPLAY_COMPLETED, data);
            }
            log.info("[REPLAY] replay {} finished: state={} completed={}/{} toolCalls={} coverage={}%",
                    replayId, result.getFinalState().wire(), result.getCompletedInteractions(),
                    result.getTotalInteractions(), result.getToolCallsReplayed(), result.getDataCoverageRate());
            return result;
        } catch (RuntimeException e) {
            lock.lock();
            try {
                state = ReplayState.ERROR;
                stateChanged.signalAll();
            } finally {
                lock.unlock();
            }
            log.error("[REPLAY] replay {} failed for session {}: {}", replayId, sessionId, e.toString());
            emit(ReplayEvent.error(replayId, sessionId, clock.instant(), e));
            throw e;
        }
    }

    private void buildDataMappings(ReplayScenario scenario) {
        layerRecords.clear();
        toolCallResults.clear();

        List<Interaction> tl = new ArrayList<>();
        for (LedgerEntry rec : scenario.records()) {
            JsonNode detail = loader.loadRecordDetail(rec);
            if (detail == null) {
                log.warn("[REPLAY] skip record {} (detail not loadable)", rec.recordId());
                continue;
            }
            layerRecords.computeIfAbsent(rec.layer() + "-" + rec.operation(), k -> new CopyOnWriteArrayList<>())
                    .add(new LoadedRecord(rec, detail));
            registerToolCalls(rec, detail);

            String ts = firstNonBlank(detail.path("timestamp").asText(null), rec.timestamp(), clock.instant().toString());
            tl.add(new Interaction(ts, rec.recordId(), rec.layer(), rec.operation(),
                    detail.get("data"), detail.get("metadata")));
        }

        // List.sort 是稳定排序，时间相同的保持场景顺序
        tl.sort(Comparator.comparing((Interaction i) -> parseInstant(i.timestamp())));
        timeline = List.copyOf(tl);
        totalSteps = tl.size();
        log.info("[REPLAY] mappings built: layers={} toolCalls={} timeline={}",
                layerRecords.size(), toolCallResults.size(), tl.size());
    }

    private void registerToolCalls(LedgerEntry rec, JsonNode detail) {
        JsonNode data = detail.get("data");
        if (data == null || !data.isContainerNode()) return;
        String ts = detail.path("timestamp").asText(rec.timestamp());

        for (ToolCallDescriptor call : extractor.findToolCalls(data)) {
            ToolCallResult found = loader.findToolCallResult(call.id(), call.name());
            toolCallResults.put(call.id(), new ToolCallMapping(call, found, rec.recordId(), ts, found != null));
            log.debug("[REPLAY] tool call {} ({}) result={}", call.name(), call.id(), found == null ? "missing" : found.sourceFile());
        }

        // 同一载荷里的内联结果覆盖库里找到的
        String source = fileName(rec);
        for (JsonNode inline : extractor.findToolResults(data, false)) {
            String id = ToolCallExtractor.resultCallId(inline);
            if (id == null) continue;
            toolCallResults.computeIfPresent(id, (k, m) -> m.withResult(new ToolCallResult(inline, source, ts)));
        }
    }

    private ReplayResult executeReplay() {
        Instant started = clock.instant();
        List<Interaction> tl = timeline;
        ReplayOptions opts = options;

        ReplayResult result = new ReplayResult();
        result.setReplayId(replayId);
        result.setSessionId(currentSessionId);
        result.setStartTime(started.toString());
        result.setTotalInteractions(tl.size());
        result.setDynamicDataLoaded(layerRecords.size());

        int withPayload = 0;
        for (int i = Math.max(0, opts.getReplayFromStep()); i < tl.size(); i++) {
            if (!awaitRunnable()) break;

            Interaction it = tl.get(i);
            currentStep = i + 1;
            if (!opts.includesLayer(it.layer())) continue;

            try {
                InteractionResult r = executeInteraction(i + 1, it);
                result.getExecutionDetails().add(r);
                result.setCompletedInteractions(result.getCompletedInteractions() + 1);
                result.setToolCallsReplayed(result.getToolCallsReplayed() + r.toolCallsReplayed());
                if (r.hasRealData()) withPayload++;

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("step", i + 1);
                data.put("recordId", it.recordId());
                data.put("layer", it.layer());
                data.put("operation", it.operation());
                data.put("toolCallsReplayed", r.toolCallsReplayed());
                data.put("progress", tl.isEmpty() ? 0.0 : (i + 1) * 100.0 / tl.size());
                emit(ReplayEventType.INTERACTION_REPLAYED, data);
            } catch (RuntimeException e) {
                log.warn("[REPLAY] step {} ({}) failed: {}", i + 1, it.recordId(), e.toString());
                result.getErrors().add(new ReplayError(i + 1, it.recordId(), String.valueOf(e.getMessage()),
                        clock.instant().toString()));
            }

            if (opts.isPreserveTimestamp() && i < tl.size() - 1) {
                pace(gapMillis(it, tl.get(i + 1)));
            }
        }

        int completed = result.getCompletedInteractions();
        result.setDataCoverageRate(completed > 0 ? withPayload * 100.0 / completed : 0.0);
        Instant ended = clock.instant();
        result.setEndTime(ended.toString());
        result.setTotalDuration(Math.max(0, ended.toEpochMilli() - started.toEpochMilli()));
        return result;
    }

    private InteractionResult executeInteraction(int step, Interaction it) {
        List<ReplayedToolCall> replayed = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        if (it.data() != null && it.data().isContainerNode()) {
            for (ToolCallDescriptor call : extractor.findToolCalls(it.data())) {
                ToolCallMapping m = toolCallResults.get(call.id());
                if (m != null && m.hasRealResult()) {
                    replayed.add(new ReplayedToolCall(call.id(), call.name(), RESULT_SOURCE, m.result().result()));
                } else {
                    missing.add(call.name());
                    log.warn("[REPLAY] step {} tool call {} ({}) has no recorded result", step, call.name(), call.id());
                }
            }
        }

        Map<String, Object> original = new LinkedHashMap<>();
        original.put("size", it.data() == null ? 2 : it.data().toString().length());
        original.put("hasMetadata", it.metadata() != null && !it.metadata().isNull());
        original.put("dataSource", "database-recorded");

        return new InteractionResult(step, it.recordId(), it.layer(), it.operation(), it.timestamp(),
                it.hasPayload(), replayed.size(), replayed, missing, original);
    }

    private void saveResult(ReplayResult result) {
        try {
            Path file = store.writeRecord(Namespace.REPLAY,
                    "dynamic-replay-" + replayId + "-" + clock.millis(), result);
            log.info("[REPLAY] result saved: {}", file.getFileName());
        } catch (DebugDataException e) {
            log.error("[REPLAY] failed to save result of replay {}: {}", replayId, e.toString());
        }
    }

    // ---------- 节奏控制 ----------

    /** 暂停时在这里等；返回 false 表示应当结束循环 */
    private boolean awaitRunnable() {
        lock.lock();
        try {
            while (state == ReplayState.PAUSED) {
                stateChanged.await();
            }
            return state == ReplayState.RUNNING;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[REPLAY] replay {} interrupted, stopping", replayId);
            state = ReplayState.STOPPED;
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** 录制间隔除以倍速；maxDelay 大于 0 时作为上限，截断会记一条 info */
    long scaledDelayMillis(long recordedGapMillis) {
        if (recordedGapMillis <= 0) return 0;
        long scaled = (long) (recordedGapMillis / speed);
        Duration cap = props.getMaxDelay();
        if (cap != null && !cap.isZero() && !cap.isNegative() && scaled > cap.toMillis()) {
            log.info("[REPLAY] replay {} step {}: recorded gap {}ms (x{}) truncated to {}ms",
                    replayId, currentStep, recordedGapMillis, speed, cap.toMillis());
            return cap.toMillis();
        }
        return scaled;
    }

    /** 按 scaledDelayMillis 等待；状态一离开 running 就返回 */
    private void pace(long recordedGapMillis) {
        long waitMillis = scaledDelayMillis(recordedGapMillis);
        if (waitMillis <= 0) return;

        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(waitMillis);
            while (remaining > 0 && state == ReplayState.RUNNING) {
                remaining = stateChanged.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[REPLAY] replay {} interrupted while waiting, stopping", replayId);
            state = ReplayState.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    // ---------- 控制 ----------

    public void pause() {
        if (transition(ReplayState.RUNNING, ReplayState.PAUSED)) {
            log.info("[REPLAY] replay {} paused at step {}", replayId, currentStep);
            emit(ReplayEventType.REPLAY_PAUSED, stepData());
        }
    }

    public void resume() {
        if (transition(ReplayState.PAUSED, ReplayState.RUNNING)) {
            log.info("[REPLAY] replay {} resumed at step {}", replayId, currentStep);
            emit(ReplayEventType.REPLAY_RESUMED, stepData());
        }
    }

    /** 只对进行中的回放生效 */
    public void stop() {
        boolean stopped;
        lock.lock();
        try {
            stopped = state.isActive();
            if (stopped) {
                state = ReplayState.STOPPED;
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (stopped) {
            log.info("[REPLAY] replay {} stopped at step {}", replayId, currentStep);
            emit(ReplayEventType.REPLAY_STOPPED, stepData());
        }
    }

    /** 倍速限制在 [minSpeed, maxSpeed] */
    public void setSpeed(double requested) {
        if (Double.isNaN(requested)) {
            throw new IllegalArgumentException("speed must be a number");
        }
        double applied = clampSpeed(requested);
        lock.lock();
        try {
            speed = applied;
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("requested", requested);
        data.put("speed", applied);
        emit(ReplayEventType.SPEED_CHANGED, data);
    }

    public double getSpeed() {
        return speed;
    }

    public ReplayStatus getReplayStatus() {
        int total = totalSteps;
        int step = currentStep;
        return new ReplayStatus(
                replayId,
                state,
                currentSessionId,
                step,
                total,
                total > 0 ? step * 100.0 / total : 0.0,
                layerRecords.size(),
                toolCallResults.size(),
                speed,
                options
        );
    }

    // ---------- 内部 ----------

    private boolean transition(ReplayState from, ReplayState to) {
        lock.lock();
        try {
            if (state != from) return false;
            state = to;
            stateChanged.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> stepData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("currentStep", currentStep);
        data.put("totalSteps", totalSteps);
        return data;
    }

    private double clampSpeed(double s) {
        return Math.max(props.getMinSpeed(), Math.min(props.getMaxSpeed(), s));
    }

    private static long gapMillis(Interaction current, Interaction next) {
        Instant a = parseInstant(current.timestamp());
        Instant b = parseInstant(next.timestamp());
        if (a.equals(Instant.MAX) || b.equals(Instant.MAX)) return 0;
        return Math.max(0, b.toEpochMilli() - a.toEpochMilli());
    }

    /** 解析不了的时间戳排到最后 */
    static Instant parseInstant(String ts) {
        if (ts == null || ts.isBlank()) return Instant.MAX;
        try {
            return Instant.parse(ts);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(ts).toInstant();
            } catch (DateTimeParseException e2) {
                return Instant.MAX;
            }
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static String fileName(LedgerEntry rec) {
        if (rec.filePath() == null) return null;
        Path name = Path.of(rec.filePath()).getFileName();
        return name == null ? rec.filePath() : name.toString();
    }

    /** 场景记录 + 读出的全文 */
    private record LoadedRecord(LedgerEntry entry, JsonNode detail) {}
}
