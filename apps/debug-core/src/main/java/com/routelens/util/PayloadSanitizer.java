package com.routelens.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.routelens.config.RecorderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 入库前的脱敏：在 JsonNode 树上递归替换敏感字段。
 * 任何输入都不会让它抛异常；无法转成树的值按字符串原样保留。
 */
@Slf4j
@Component
public class PayloadSanitizer {

    private final ObjectMapper om;
    private final String marker;
    private final List<Pattern> patterns;
    private final Pattern usageCount;

    private static final Pattern CREDENTIAL_HINT =
            Pattern.compile("auth|secret|credential|bearer|access|refresh|password", Pattern.CASE_INSENSITIVE);

    public PayloadSanitizer(ObjectMapper om, RecorderProperties props) {
        this.om = om;
        this.marker = props.getRedactionMarker();
        this.patterns = props.getSensitivePatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.usageCount = Pattern.compile(props.getUsageCountPattern(), Pattern.CASE_INSENSITIVE);
    }

    public String marker() {
        return marker;
    }

    /** 任意对象转 JsonNode；失败（循环引用、不可序列化的 bean）时退化成文本节点 */
    public JsonNode toTree(Object data) {
        if (data == null) return NullNode.getInstance();
        if (data instanceof JsonNode node) return node;
        try {
            return om.valueToTree(data);
        } catch (RuntimeException e) {
            log.debug("[SANITIZE] value of type {} not convertible to JSON: {}", data.getClass().getName(), e.toString());
            return TextNode.valueOf(safeToString(data));
        }
    }

    /** 转树并脱敏，返回新树，不修改入参 */
    public JsonNode sanitize(Object data) {
        return redact(toTree(data));
    }

    public boolean isSensitiveField(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) return false;
        boolean matched = false;
        for (Pattern p : patterns) {
            if (p.matcher(fieldName).find()) {
                matched = true;
                break;
            }
        }
        if (!matched) return false;
        // 只有纯用量计数字段豁免；access_tokens / authTokens 仍是凭据
        return !usageCount.matcher(fieldName).matches() || CREDENTIAL_HINT.matcher(fieldName).find();
    }

    /** 序列化后的字节数，作为大小指标 */
    public int sizeOf(JsonNode node) {
        try {
            return om.writeValueAsString(node).getBytes(StandardCharsets.UTF_8).length;
        } catch (Exception e) {
            return String.valueOf(node).length();
        }
    }

    private JsonNode redact(JsonNode node) {
        if (node == null) return NullNode.getInstance();
        if (node.isObject()) {
            ObjectNode dst = om.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (isSensitiveField(e.getKey())) {
                    dst.put(e.getKey(), marker);
                } else {
                    dst.set(e.getKey(), redact(e.getValue()));
                }
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = om.createArrayNode();
            for (JsonNode item : node) arr.add(redact(item));
            return arr;
        }
        return node;
    }

    private static String safeToString(Object data) {
        try {
            return String.valueOf(data);
        } catch (RuntimeException e) {
            return data.getClass().getName();
        }
    }
}
