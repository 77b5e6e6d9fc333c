package com.routelens.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.config.ReplayProperties;
import com.routelens.replay.dto.ToolCallDescriptor;
import com.routelens.util.JsonCanonicalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.Collections;

/**
 * 在录制载荷里找工具调用和工具结果（启发式，按容器字段名匹配）。
 *
 * 调用形态：
 *   OpenAI   {tool_calls:[{id, type:"function", function:{name, arguments}}]}
 *   Anthropic {content:[{type:"tool_use", id, name, input}]}
 *   其他      {toolCalls|tools|function_calls:[{id, name, args|parameters}]}
 * 结果形态：
 *   {tool_results|toolResults|results|tool_call_results:[{tool_call_id|id, name, ...}]}
 *   Anthropic {type:"tool_result", tool_use_id, content}
 */
@Component
public class ToolCallExtractor {

    private final ObjectMapper om;
    private final List<String> callFields;
    private final List<String> resultFields;

    public ToolCallExtractor(ObjectMapper om, ReplayProperties props) {
        this.om = om;
        this.callFields = List.copyOf(props.getToolCallFields());
        this.resultFields = List.copyOf(props.getToolResultFields());
    }

    /** 递归找出所有工具调用，按 id 去重，保持发现顺序 */
    public List<ToolCallDescriptor> findToolCalls(JsonNode data) {
        Map<String, ToolCallDescriptor> found = new LinkedHashMap<>();
        if (data != null && data.isContainerNode()) {
            searchCalls(data, found, Collections.newSetFromMap(new IdentityHashMap<>()));
        }
        return new ArrayList<>(found.values());
    }

    /** 找出工具结果条目；recursive=false 时只看顶层容器字段 */
    public List<JsonNode> findToolResults(JsonNode data, boolean recursive) {
        List<JsonNode> out = new ArrayList<>();
        if (data != null && data.isContainerNode()) {
            searchResults(data, recursive, out);
        }
        return out;
    }

    /** 结果条目是否对应某个调用 id（tool_call_id / id / tool_use_id） */
    public static boolean matchesId(JsonNode result, String toolCallId) {
        if (toolCallId == null) return false;
        return toolCallId.equals(text(result, "tool_call_id"))
                || toolCallId.equals(text(result, "id"))
                || toolCallId.equals(text(result, "tool_use_id"));
    }

    public static boolean matchesName(JsonNode result, String toolName) {
        return toolName != null && toolName.equals(text(result, "name"));
    }

    /** 结果条目自身声明的调用 id */
    public static String resultCallId(JsonNode result) {
        String id = text(result, "tool_call_id");
        if (id == null) id = text(result, "tool_use_id");
        if (id == null) id = text(result, "id");
        return id;
    }

    // ---------- 内部 ----------

    private void searchCalls(JsonNode node, Map<String, ToolCallDescriptor> found, Set<JsonNode> seen) {
        if (node == null || !node.isContainerNode() || !seen.add(node)) return;

        if (node.isObject()) {
            for (String field : callFields) {
                JsonNode arr = node.get(field);
                if (arr != null && arr.isArray()) {
                    for (JsonNode call : arr) {
                        ToolCallDescriptor d = toDescriptor(call);
                        if (d != null) found.putIfAbsent(d.id(), d);
                    }
                }
            }
            if ("tool_use".equals(text(node, "type"))) {
                ToolCallDescriptor d = toDescriptor(node);
                if (d != null) found.putIfAbsent(d.id(), d);
            }
        }
        for (JsonNode child : node) {
            if (child.isContainerNode()) searchCalls(child, found, seen);
        }
    }

    private void searchResults(JsonNode node, boolean recursive, List<JsonNode> out) {
        if (node.isObject()) {
            for (String field : resultFields) {
                JsonNode arr = node.get(field);
                if (arr != null && arr.isArray()) {
                    for (JsonNode r : arr) {
                        if (r.isObject()) out.add(r);
                    }
                }
            }
            if (recursive && "tool_result".equals(text(node, "type"))) {
                out.add(node);
            }
        }
        if (!recursive) return;
        for (JsonNode child : node) {
            if (child.isContainerNode()) searchResults(child, true, out);
        }
    }

    private ToolCallDescriptor toDescriptor(JsonNode call) {
        if (call == null || !call.isObject()) return null;
        JsonNode fn = call.path("function");
        String name = text(call, "name");
        if (name == null) name = text(fn, "name");
        if (name == null) return null;

        JsonNode args = firstPresent(call.get("args"), fn.get("arguments"), call.get("parameters"), call.get("input"));
        String id = text(call, "id");
        if (id == null) {
            // 录制数据没给 id 时，用调用内容的指纹，保证同一份数据两次提取得到同一个 id
            id = "tool-" + JsonCanonicalizer.shortFingerprint(om, call, 16);
        }
        String type = Objects.requireNonNullElse(text(call, "type"), "function");
        return new ToolCallDescriptor(id, name, args == null ? om.createObjectNode() : args, type);
    }

    private static JsonNode firstPresent(JsonNode... nodes) {
        for (JsonNode n : nodes) {
            if (n != null && !n.isNull() && !n.isMissingNode()) return n;
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }
}
