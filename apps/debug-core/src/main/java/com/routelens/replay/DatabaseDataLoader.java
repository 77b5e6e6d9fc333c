package com.routelens.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.routelens.error.DebugDataException;
import com.routelens.recorder.dto.LedgerEntry;
import com.routelens.recorder.dto.ReplayScenario;
import com.routelens.replay.dto.ToolCallResult;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 从录制库读回放所需的数据。
 * 单条记录读不到只记日志，由调用方跳过；目录列举失败照常抛出。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseDataLoader {

    static final String SCENARIO_PREFIX = "scenario-";

    private final RecordStore store;
    private final ToolCallExtractor extractor;

    /** 取该会话最新的场景（按 createdAt，其次文件名） */
    public Optional<ReplayScenario> loadSessionData(String sessionId) {
        log.info("[LOADER] loading scenario for session {}", sessionId);
        Optional<ReplayScenario> found = listScenarios().stream()
                .filter(s -> sessionId != null && sessionId.equals(s.sessionId()))
                .reduce((a, b) -> b);
        found.ifPresentOrElse(
                s -> log.info("[LOADER] scenario '{}' picked for session {} ({} records)",
                        s.scenarioName(), sessionId, s.records().size()),
                () -> log.warn("[LOADER] no scenario for session {}", sessionId));
        return found;
    }

    /** 所有可解析的场景，按创建时间升序；损坏文件跳过 */
    public List<ReplayScenario> listScenarios() {
        List<Path> files = store.listRecords(Namespace.REPLAY, name -> name.startsWith(SCENARIO_PREFIX));
        List<ReplayScenario> out = new ArrayList<>();
        for (Path file : files) {
            try {
                out.add(store.readRecord(file, ReplayScenario.class));
            } catch (DebugDataException e) {
                log.warn("[LOADER] skip unreadable scenario {}: {}", file.getFileName(), e.getMessage());
            }
        }
        // listRecords 已按文件名排过序，这里的稳定排序只在 createdAt 不同时调整
        out.sort(Comparator.comparing((ReplayScenario s) -> s.createdAt() == null ? "" : s.createdAt()));
        return out;
    }

    /** 读记录全文；缺路径、文件不存在或损坏时返回 null */
    public JsonNode loadRecordDetail(LedgerEntry record) {
        if (record == null || record.filePath() == null || record.filePath().isBlank()) {
            log.warn("[LOADER] record {} has no file path", record == null ? null : record.recordId());
            return null;
        }
        try {
            return store.readRecord(Path.of(record.filePath()));
        } catch (DebugDataException e) {
            log.warn("[LOADER] failed to load record {}: {}", record.recordId(), e.getMessage());
            return null;
        }
    }

    /**
     * 在全部层级文件里找工具结果：先按 id 精确匹配，整轮没有再退回第一个同名结果。
     */
    public ToolCallResult findToolCallResult(String toolCallId, String toolName) {
        ToolCallResult byName = null;
        for (Path file : store.listRecords(Namespace.LAYERS, null)) {
            JsonNode content;
            try {
                content = store.readRecord(file);
            } catch (DebugDataException e) {
                log.debug("[LOADER] skip {} while searching tool results: {}", file.getFileName(), e.getMessage());
                continue;
            }
            JsonNode data = content.get("data");
            if (data == null || !data.isContainerNode()) continue;

            String ts = content.path("timestamp").asText(null);
            for (JsonNode result : extractor.findToolResults(data, true)) {
                if (ToolCallExtractor.matchesId(result, toolCallId)) {
                    return new ToolCallResult(result, file.getFileName().toString(), ts);
                }
                if (byName == null && ToolCallExtractor.matchesName(result, toolName)) {
                    byName = new ToolCallResult(result, file.getFileName().toString(), ts);
                }
            }
        }
        return byName;
    }
}
