package com.routelens.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.DebugTestSupport;
import com.routelens.audit.AuditTrailBuilder;
import com.routelens.audit.dto.AuditQuery;
import com.routelens.audit.dto.Trace;
import com.routelens.audit.dto.TraceQueryResult;
import com.routelens.audit.dto.TraceStatus;
import com.routelens.config.ReplayProperties;
import com.routelens.recorder.DebugRecorder;
import com.routelens.recorder.dto.LedgerEntry;
import com.routelens.replay.DatabaseDataLoader;
import com.routelens.replay.ToolCallExtractor;
import com.routelens.session.dto.DebugReport;
import com.routelens.storage.Namespace;
import com.routelens.storage.impl.FileRecordStore;
import com.routelens.util.PayloadSanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebugSessionTest {

    @TempDir
    Path root;

    private FileRecordStore store;
    private DebugTestSupport.MutableClock clock;
    private DebugSession session;

    @BeforeEach
    void setUp() {
        ObjectMapper om = DebugTestSupport.mapper();
        store = DebugTestSupport.store(om, root);
        clock = new DebugTestSupport.MutableClock(Instant.parse("2025-08-13T10:00:00Z"));
        PayloadSanitizer sanitizer = DebugTestSupport.sanitizer(om);
        SessionContext ctx = SessionContext.open(clock.instant());
        DatabaseDataLoader loader = new DatabaseDataLoader(store, new ToolCallExtractor(om, new ReplayProperties()));
        session = new DebugSession(ctx,
                new DebugRecorder(ctx, store, sanitizer, om, clock),
                new AuditTrailBuilder(ctx, store, sanitizer, om, clock),
                store, loader, clock);
    }

    @Test
    void instrumentRecordsInputOutputTraceAndPerformance() throws Exception {
        String out = session.instrument("router", "route", Map.of("model", "gpt-4", "apiKey", "sk-1"), () -> {
            clock.advance(Duration.ofMillis(25));
            return "openai";
        });

        assertThat(out).isEqualTo("openai");
        assertThat(session.recorder().ledger()).extracting(LedgerEntry::operation).containsExactly("input", "output");

        LedgerEntry input = session.recorder().ledger().get(0);
        JsonNode inputRec = store.readRecord(Path.of(input.filePath()));
        assertThat(inputRec.at("/data/apiKey").asText()).isEqualTo("[REDACTED]");
        assertThat(inputRec.at("/metadata/method").asText()).isEqualTo("route");

        JsonNode outputRec = store.readRecord(Path.of(session.recorder().ledger().get(1).filePath()));
        assertThat(outputRec.at("/metadata/inputRecordId").asText()).isEqualTo(input.recordId());
        assertThat(outputRec.at("/metadata/status").asText()).isEqualTo("success");

        List<TraceQueryResult> traces = session.auditTrail().queryAuditTrail(AuditQuery.all());
        assertThat(traces).hasSize(1);
        Trace trace = traces.get(0).trace();
        assertThat(trace.getStatus()).isEqualTo(TraceStatus.SUCCESS);
        assertThat(trace.getDuration()).isEqualTo(25L);
        assertThat(store.listRecords(Namespace.TRANSFORMATIONS, null)).hasSize(1);
        assertThat(store.listRecords(Namespace.PERFORMANCE, n -> n.startsWith("perf-router-"))).hasSize(1);
        assertThat(session.status().activeOperations()).isZero();
    }

    @Test
    void instrumentRecordsErrorAndRethrows() {
        IOException boom = new IOException("upstream closed");

        assertThatThrownBy(() -> session.instrument("provider", "call", Map.of("q", 1), () -> {
            throw boom;
        })).isSameAs(boom);

        LedgerEntry last = session.recorder().ledger().get(1);
        assertThat(last.operation()).isEqualTo("error");
        JsonNode errorRec = store.readRecord(Path.of(last.filePath()));
        assertThat(errorRec.at("/data/error").asText()).isEqualTo("upstream closed");
        assertThat(errorRec.at("/data/type").asText()).isEqualTo("java.io.IOException");

        Trace trace = session.auditTrail().queryAuditTrail(AuditQuery.all()).get(0).trace();
        assertThat(trace.getStatus()).isEqualTo(TraceStatus.ERROR);
        assertThat(session.status().activeOperations()).isZero();
    }

    @Test
    void nestedInstrumentLinksParentTrace() throws Exception {
        String parent = session.auditTrail().startLayerTrace("client", "send", Map.of("m", 1));

        session.instrument("router", "route", Map.of("m", 1), parent, () -> Map.of("m", 1));

        assertThat(session.auditTrail().getTrace(parent).orElseThrow().getChildren()).hasSize(1);
    }

    @Test
    void reportListsSessionScenariosAndIsPersisted() throws Exception {
        session.instrument("client", "send", Map.of("q", "hi"), () -> "ok");
        session.createReplayScenario("smoke");

        DebugReport report = session.generateDebugReport();

        assertThat(report.sessionId()).isEqualTo(session.sessionId());
        assertThat(report.availableScenarios()).containsExactly("smoke");
        assertThat(report.recordingSummary().recordCount()).isEqualTo(2);
        assertThat(report.auditSummary().totalTraces()).isEqualTo(1);
        assertThat(root.resolve("sessions/debug-report-" + session.sessionId() + ".json")).isRegularFile();
    }

    @Test
    void closeWritesLedgerIndexOnce() throws Exception {
        session.instrument("client", "send", Map.of("q", "hi"), () -> "ok");

        session.close();
        session.close();

        Path index = root.resolve("indexes/ledger-" + session.sessionId() + ".json");
        assertThat(index).isRegularFile();
        assertThat(store.readRecord(index).get("recordCount").asInt()).isEqualTo(2);
        assertThat(session.status().closed()).isTrue();
    }
}
