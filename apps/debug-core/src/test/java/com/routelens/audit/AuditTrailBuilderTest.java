package com.routelens.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.DebugTestSupport;
import com.routelens.audit.dto.AuditQuery;
import com.routelens.audit.dto.AuditSummary;
import com.routelens.audit.dto.DataFlowEntry;
import com.routelens.audit.dto.Lineage;
import com.routelens.audit.dto.Trace;
import com.routelens.audit.dto.TraceQueryResult;
import com.routelens.audit.dto.TraceStatus;
import com.routelens.audit.dto.TransformationRecord;
import com.routelens.error.InvalidStateException;
import com.routelens.error.NotFoundException;
import com.routelens.session.SessionContext;
import com.routelens.storage.Namespace;
import com.routelens.storage.impl.FileRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditTrailBuilderTest {

    @TempDir
    Path root;

    private ObjectMapper om;
    private FileRecordStore store;
    private DebugTestSupport.MutableClock clock;
    private AuditTrailBuilder audit;

    @BeforeEach
    void setUp() {
        om = DebugTestSupport.mapper();
        store = DebugTestSupport.store(om, root);
        clock = new DebugTestSupport.MutableClock(Instant.parse("2025-08-13T10:00:00Z"));
        audit = new AuditTrailBuilder(SessionContext.open(clock.instant()), store,
                DebugTestSupport.sanitizer(om), om, clock);
    }

    @Test
    void constructorWritesSessionFile() {
        assertThat(root.resolve("sessions/session-" + audit.sessionId() + ".json")).isRegularFile();
    }

    @Test
    void routerRewriteIsRecordedAsModification() {
        String traceId = audit.startLayerTrace("router", "route", Map.of("model", "gpt-4"));
        clock.advance(Duration.ofMillis(40));
        audit.completeLayerTrace(traceId, Map.of("model", "gpt-4", "provider", "openai"), TraceStatus.SUCCESS);

        List<Path> files = store.listRecords(Namespace.TRANSFORMATIONS, n -> n.startsWith("transform-"));
        assertThat(files).hasSize(1);
        TransformationRecord rec = store.readRecord(files.get(0), TransformationRecord.class);
        assertThat(rec.traceId()).isEqualTo(traceId);
        assertThat(rec.layer()).isEqualTo("router");
        assertThat(rec.transformation().type().wire()).isEqualTo("modification");
        assertThat(rec.transformation().fieldsAdded()).containsExactly("provider");

        JsonNode sessionFile = store.readRecord(root.resolve("sessions/session-" + audit.sessionId() + ".json"));
        assertThat(sessionFile.get("transformationCount").asInt()).isEqualTo(1);
        assertThat(sessionFile.at("/traceabilityIndex/" + rec.transformationId() + "/traceId").asText())
                .isEqualTo(traceId);
    }

    @Test
    void identicalOutputRecordsNoTransformation() {
        String traceId = audit.startLayerTrace("transformer", "convert", Map.of("a", 1, "b", 2));
        audit.completeLayerTrace(traceId, Map.of("b", 2, "a", 1), TraceStatus.SUCCESS);

        assertThat(store.listRecords(Namespace.TRANSFORMATIONS, null)).isEmpty();
        assertThat(audit.getAuditSummary().transformationStats().totalTransformations()).isZero();
    }

    @Test
    void durationIsEndMinusStart() {
        String traceId = audit.startLayerTrace("provider", "call", Map.of("q", 1));
        clock.advance(Duration.ofMillis(1234));

        Trace done = audit.completeLayerTrace(traceId, Map.of("q", 1), TraceStatus.SUCCESS, Map.of("retries", 0));

        assertThat(done.getDuration()).isEqualTo(1234L);
        assertThat(done.getStatus()).isEqualTo(TraceStatus.SUCCESS);
        assertThat(done.getEndTime()).isEqualTo("2025-08-13T10:00:01.234Z");
        assertThat(done.getMetadata()).containsEntry("retries", 0);

        JsonNode persisted = store.readRecord(root.resolve("traces/trace-" + traceId + ".json"));
        assertThat(persisted.get("status").asText()).isEqualTo("success");
        assertThat(persisted.at("/metadata/duration").asLong()).isEqualTo(1234L);
    }

    @Test
    void callerMetricsCannotOverrideTiming() {
        String traceId = audit.startLayerTrace("provider", "call", Map.of());
        clock.advance(Duration.ofMillis(10));

        Trace done = audit.completeLayerTrace(traceId, Map.of(), TraceStatus.WARNING, Map.of("duration", 999_999));

        assertThat(done.getDuration()).isEqualTo(10L);
    }

    @Test
    void completingUnknownTraceThrowsNotFound() {
        assertThatThrownBy(() -> audit.completeLayerTrace("nope", Map.of(), TraceStatus.SUCCESS))
                .isInstanceOf(NotFoundException.class)
                .extracting(e -> ((NotFoundException) e).getKind())
                .isEqualTo(NotFoundException.Kind.TRACE);
    }

    @Test
    void completingTwiceThrowsInvalidState() {
        String traceId = audit.startLayerTrace("router", "route", Map.of());
        audit.completeLayerTrace(traceId, Map.of(), TraceStatus.SUCCESS);

        assertThatThrownBy(() -> audit.completeLayerTrace(traceId, Map.of(), TraceStatus.ERROR))
                .isInstanceOf(InvalidStateException.class);
        assertThat(audit.getTrace(traceId).orElseThrow().getStatus()).isEqualTo(TraceStatus.SUCCESS);
    }

    @Test
    void completingWithStartedStatusIsRejected() {
        String traceId = audit.startLayerTrace("router", "route", Map.of());

        assertThatThrownBy(() -> audit.completeLayerTrace(traceId, Map.of(), TraceStatus.STARTED))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void traceInputIsSanitized() {
        String traceId = audit.startLayerTrace("client", "send", Map.of("api_key", "sk-1", "prompt", "hi"));

        Trace t = audit.getTrace(traceId).orElseThrow();
        assertThat(t.getInputData().get("api_key").asText()).isEqualTo("[REDACTED]");
        assertThat(t.getInputData().get("prompt").asText()).isEqualTo("hi");
    }

    @Test
    void lineageCoversRootAndDescendantsOnce() {
        String rootId = audit.startLayerTrace("client", "send", Map.of("m", 1));
        String router = audit.startLayerTrace("router", "route", Map.of("m", 1), rootId);
        String provider = audit.startLayerTrace("provider", "call", Map.of("m", 1), router);
        String sibling = audit.startLayerTrace("transformer", "convert", Map.of("m", 1), rootId);
        audit.startLayerTrace("client", "send", Map.of("other", true));
        clock.advance(Duration.ofMillis(20));
        audit.completeLayerTrace(provider, Map.of("m", 2), TraceStatus.SUCCESS);
        audit.completeLayerTrace(router, Map.of("m", 1), TraceStatus.SUCCESS);

        Lineage lineage = audit.buildDataLineage(rootId);

        assertThat(lineage.dataFlow()).extracting(DataFlowEntry::traceId)
                .containsExactly(rootId, router, provider, sibling);
        assertThat(lineage.layerSequence()).containsExactly("client", "router", "provider", "transformer");
        assertThat(lineage.transformations()).hasSize(1);
        assertThat(lineage.metadata().totalLayers()).isEqualTo(4);
        assertThat(lineage.metadata().totalTransformations()).isEqualTo(1);
        assertThat(lineage.metadata().totalDuration()).isEqualTo(40L);
        assertThat(store.listRecords(Namespace.LINEAGE, n -> n.startsWith("lineage-" + rootId))).hasSize(1);

        assertThat(audit.getTrace(rootId).orElseThrow().getChildren()).containsExactly(router, sibling);
    }

    @Test
    void lineageTerminatesOnCyclicChildren() {
        String a = audit.startLayerTrace("client", "send", Map.of("m", 1));
        String b = audit.startLayerTrace("router", "route", Map.of("m", 1), a);
        String c = audit.startLayerTrace("provider", "call", Map.of("m", 1), b);
        // a -> b -> a，另加 c 自环
        assertThat(audit.linkChild(b, a)).isTrue();
        assertThat(audit.linkChild(c, c)).isTrue();

        Lineage fromA = audit.buildDataLineage(a);
        Lineage fromB = audit.buildDataLineage(b);

        assertThat(fromA.dataFlow()).extracting(DataFlowEntry::traceId).containsExactly(a, b, c);
        assertThat(fromB.dataFlow()).extracting(DataFlowEntry::traceId).containsExactly(b, c, a);
        assertThat(fromA.metadata().totalLayers()).isEqualTo(3);
        assertThat(audit.getTrace(b).orElseThrow().getChildren()).containsExactly(c, a);
    }

    @Test
    void linkToUnknownParentIsRejected() {
        String a = audit.startLayerTrace("client", "send", Map.of("m", 1));

        assertThat(audit.linkChild("missing", a)).isFalse();
        assertThat(audit.buildDataLineage(a).dataFlow()).hasSize(1);
    }

    @Test
    void lineageOfUnknownTraceThrows() {
        assertThatThrownBy(() -> audit.buildDataLineage("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unknownParentIsKeptButNotLinked() {
        String orphan = audit.startLayerTrace("router", "route", Map.of(), "ghost");

        Trace t = audit.getTrace(orphan).orElseThrow();
        assertThat(t.getParentTraceId()).isEqualTo("ghost");
        assertThat(audit.buildDataLineage(orphan).dataFlow()).hasSize(1);
    }

    @Test
    void queryFiltersAndSorts() {
        String slow = audit.startLayerTrace("provider", "call", Map.of("n", 1));
        clock.advance(Duration.ofMillis(10));
        String fast = audit.startLayerTrace("provider", "call", Map.of("n", 2));
        String other = audit.startLayerTrace("router", "route", Map.of("n", 3));
        clock.advance(Duration.ofMillis(5));
        audit.completeLayerTrace(fast, Map.of("n", 2), TraceStatus.SUCCESS);
        clock.advance(Duration.ofMillis(100));
        audit.completeLayerTrace(slow, Map.of("n", 1), TraceStatus.ERROR);

        List<TraceQueryResult> byDurationDesc = audit.queryAuditTrail(AuditQuery.builder()
                .layer("provider")
                .sortBy(AuditQuery.SortKey.DURATION)
                .direction(AuditQuery.Direction.DESC)
                .build());
        assertThat(byDurationDesc).extracting(r -> r.trace().getTraceId()).containsExactly(slow, fast);
        assertThat(byDurationDesc).allSatisfy(r -> assertThat(r.lineage()).isNull());

        List<TraceQueryResult> errors = audit.queryAuditTrail(AuditQuery.builder()
                .status(TraceStatus.ERROR).includeLineage(true).build());
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).lineage().rootTraceId()).isEqualTo(slow);

        List<TraceQueryResult> window = audit.queryAuditTrail(AuditQuery.builder()
                .startTime(Instant.parse("2025-08-13T10:00:00.005Z"))
                .endTime(Instant.parse("2025-08-13T10:00:00.010Z"))
                .build());
        assertThat(window).extracting(r -> r.trace().getTraceId()).containsExactlyInAnyOrder(fast, other);

        assertThat(audit.queryAuditTrail(null)).hasSize(3);
    }

    @Test
    void summaryAggregatesPerLayer() {
        String a = audit.startLayerTrace("router", "route", Map.of("x", 1));
        String b = audit.startLayerTrace("provider", "call", Map.of("x", 1), a);
        clock.advance(Duration.ofMillis(30));
        audit.completeLayerTrace(b, Map.of("x", 2), TraceStatus.ERROR);
        audit.completeLayerTrace(a, Map.of("x", 1), TraceStatus.SUCCESS);

        AuditSummary summary = audit.getAuditSummary();

        assertThat(summary.totalTraces()).isEqualTo(2);
        assertThat(summary.layerSequence()).extracting(AuditSummary.LayerSequenceEntry::layer)
                .containsExactly("router", "provider");
        assertThat(summary.layerStats().get("provider").errorCount()).isEqualTo(1);
        assertThat(summary.layerStats().get("router").successCount()).isEqualTo(1);
        assertThat(summary.layerStats().get("router").averageDuration()).isEqualTo(30.0);
        assertThat(summary.transformationStats().byLayer()).containsEntry("provider", 1);
        assertThat(summary.transformationStats().byType()).containsEntry("modification", 1);
        assertThat(summary.performanceStats().totalDuration()).isEqualTo(60L);
        assertThat(summary.dataFlowMap().get("router").children()).containsExactly("provider");
        assertThat(summary.dataFlowMap().get("provider").parents()).containsExactly("router");
        assertThat(root.resolve("audit/audit-summary-" + audit.sessionId() + ".json")).isRegularFile();
    }
}
