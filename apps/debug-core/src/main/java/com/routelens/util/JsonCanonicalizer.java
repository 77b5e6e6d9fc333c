package com.routelens.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.util.TreeMap;

/**
 * 录制数据的规范形式和指纹。
 * 对象键排序、数组保持顺序；缺失节点按 null 处理；整数值的小数（2.0）与整数（2）视为同一个值。
 * 用来判断一层的输入输出是否真的变了、计算 dataHash、给没有 id 的工具调用生成稳定 id。
 */
public final class JsonCanonicalizer {
    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return NullNode.getInstance();

        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            node.fields().forEachRemaining(e -> sorted.put(e.getKey(), e.getValue()));
            ObjectNode dst = mapper.createObjectNode();
            sorted.forEach((k, v) -> dst.set(k, normalize(mapper, v)));
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it));
            return arr;
        }
        if (node.isFloatingPointNumber() || node.isBigDecimal()) {
            return normalizeNumber(node);
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, JsonNode node) {
        JsonNode norm = normalize(mapper, node);
        try {
            return mapper.writeValueAsString(norm);
        } catch (JsonProcessingException e) {
            return String.valueOf(norm);
        }
    }

    /** 两棵树规范化后是否相同 */
    public static boolean sameContent(ObjectMapper mapper, JsonNode a, JsonNode b) {
        return canonicalize(mapper, a).equals(canonicalize(mapper, b));
    }

    /** 规范形式的 SHA-256（hex） */
    public static String fingerprint(ObjectMapper mapper, JsonNode node) {
        return DigestUtils.sha256Hex(canonicalize(mapper, node));
    }

    /** 指纹前 length 位，用作派生 id */
    public static String shortFingerprint(ObjectMapper mapper, JsonNode node, int length) {
        String full = fingerprint(mapper, node);
        return full.substring(0, Math.min(Math.max(length, 1), full.length()));
    }

    private static JsonNode normalizeNumber(JsonNode node) {
        if (node.isDouble() || node.isFloat()) {
            double d = node.doubleValue();
            if (!Double.isFinite(d)) return node;
        }
        BigDecimal dec = node.decimalValue().stripTrailingZeros();
        if (dec.scale() <= 0 && dec.precision() - dec.scale() <= 18) {
            return JsonNodeFactory.instance.numberNode(dec.longValueExact());
        }
        return node;
    }
}
