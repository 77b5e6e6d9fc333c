package com.routelens.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.DebugTestSupport;
import com.routelens.config.ReplayProperties;
import com.routelens.recorder.DebugRecorder;
import com.routelens.recorder.dto.LedgerEntry;
import com.routelens.recorder.dto.ReplayScenario;
import com.routelens.replay.dto.ToolCallResult;
import com.routelens.session.SessionContext;
import com.routelens.storage.impl.FileRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DatabaseDataLoaderTest {

    @TempDir
    Path root;

    private ObjectMapper om;
    private FileRecordStore store;
    private DebugTestSupport.MutableClock clock;
    private DatabaseDataLoader loader;

    @BeforeEach
    void setUp() {
        om = DebugTestSupport.mapper();
        store = DebugTestSupport.store(om, root);
        clock = new DebugTestSupport.MutableClock(Instant.parse("2025-08-13T10:00:00Z"));
        loader = new DatabaseDataLoader(store, new ToolCallExtractor(om, new ReplayProperties()));
    }

    private DebugRecorder newRecorder() {
        return new DebugRecorder(SessionContext.open(clock.instant()), store, DebugTestSupport.sanitizer(om), om, clock);
    }

    @Test
    void unknownSessionIsEmpty() {
        assertThat(loader.loadSessionData("nope")).isEmpty();
    }

    @Test
    void newestScenarioForSessionWins() {
        DebugRecorder rec = newRecorder();
        String id = rec.recordLayerIO("client", "input", Map.of("q", 1), null);
        rec.createReplayScenario("first", List.of());
        clock.advance(Duration.ofSeconds(1));
        rec.createReplayScenario("second", List.of(id));
        newRecorder().createReplayScenario("other-session");

        Optional<ReplayScenario> loaded = loader.loadSessionData(rec.sessionId());

        assertThat(loaded).isPresent();
        assertThat(loaded.get().scenarioName()).isEqualTo("second");
        assertThat(loaded.get().records()).extracting(LedgerEntry::recordId).containsExactly(id);
        assertThat(loader.listScenarios()).hasSize(3);
    }

    @Test
    void corruptScenarioFilesAreSkipped() throws Exception {
        DebugRecorder rec = newRecorder();
        rec.createReplayScenario("good");
        Files.writeString(root.resolve("replay/scenario-broken-1.json"), "{{{");

        assertThat(loader.listScenarios()).extracting(ReplayScenario::scenarioName).containsExactly("good");
        assertThat(loader.loadSessionData(rec.sessionId())).isPresent();
    }

    @Test
    void recordDetailIsNullWhenFileMissingOrCorrupt() throws Exception {
        DebugRecorder rec = newRecorder();
        String id = rec.recordLayerIO("router", "output", Map.of("route", "openai"), null);
        LedgerEntry entry = rec.lookup(id).orElseThrow();

        JsonNode detail = loader.loadRecordDetail(entry);
        assertThat(detail.at("/data/route").asText()).isEqualTo("openai");

        Files.writeString(Path.of(entry.filePath()), "not-json{");
        assertThat(loader.loadRecordDetail(entry)).isNull();

        Files.delete(Path.of(entry.filePath()));
        assertThat(loader.loadRecordDetail(entry)).isNull();
        assertThat(loader.loadRecordDetail(new LedgerEntry("x", "l", "input", null, null))).isNull();
    }

    @Test
    void toolResultMatchedByIdBeforeName() {
        DebugRecorder rec = newRecorder();
        rec.recordLayerIO("provider", "output",
                Map.of("tool_results", List.of(Map.of("name", "search", "content", "by-name"))), null);
        rec.recordLayerIO("provider", "output",
                Map.of("tool_results", List.of(Map.of("tool_call_id", "call_7", "name", "other", "content", "by-id"))), null);

        ToolCallResult byId = loader.findToolCallResult("call_7", "search");
        assertThat(byId).isNotNull();
        assertThat(byId.result().get("content").asText()).isEqualTo("by-id");
        assertThat(byId.sourceFile()).startsWith("provider-output-");

        ToolCallResult byName = loader.findToolCallResult("call_unknown", "search");
        assertThat(byName.result().get("content").asText()).isEqualTo("by-name");

        assertThat(loader.findToolCallResult("call_unknown", "nothing")).isNull();
    }
}
