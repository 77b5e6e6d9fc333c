package com.routelens.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.routelens.audit.dto.TransformationAnalysis;
import com.routelens.audit.dto.TransformationType;
import com.routelens.util.JsonCanonicalizer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 输入/输出变换的启发式分类，只看类型和形状：
 *   输入为空 → creation；输出为空 → deletion；
 *   标量类型不同 → type-conversion；数组/对象互换 → structure-change；
 *   其余 → modification。
 * 字段差异只比较顶层键。
 */
public final class TransformationClassifier {
    private TransformationClassifier() {}

    public static boolean hasTransformation(ObjectMapper om, JsonNode input, JsonNode output) {
        return !JsonCanonicalizer.sameContent(om, input, output);
    }

    public static TransformationAnalysis analyze(ObjectMapper om, JsonNode input, JsonNode output) {
        TransformationType type = classify(input, output);
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        if (input != null && output != null && input.isObject() && output.isObject()) {
            Iterator<String> in = input.fieldNames();
            while (in.hasNext()) {
                String f = in.next();
                if (!output.has(f)) {
                    removed.add(f);
                } else if (hasTransformation(om, input.get(f), output.get(f))) {
                    modified.add(f);
                }
            }
            Iterator<String> out = output.fieldNames();
            while (out.hasNext()) {
                String f = out.next();
                if (!input.has(f)) added.add(f);
            }
        }
        return new TransformationAnalysis(type, added, removed, modified);
    }

    static TransformationType classify(JsonNode input, JsonNode output) {
        if (isEmpty(input)) return TransformationType.CREATION;
        if (isEmpty(output)) return TransformationType.DELETION;
        if (!typeOf(input).equals(typeOf(output))) return TransformationType.TYPE_CONVERSION;
        if (input.isArray() != output.isArray()) return TransformationType.STRUCTURE_CHANGE;
        return TransformationType.MODIFICATION;
    }

    private static boolean isEmpty(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode()
                || (node.isTextual() && node.textValue().isEmpty());
    }

    /** 粗粒度类型：对象和数组同属 container，区分放在 structure-change 里 */
    private static String typeOf(JsonNode node) {
        if (node.isContainerNode() || node.isPojo()) return "container";
        if (node.isTextual() || node.isBinary()) return "string";
        if (node.isNumber()) return "number";
        if (node.isBoolean()) return "boolean";
        return node.getNodeType().name();
    }
}
