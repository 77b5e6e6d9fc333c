package com.routelens.audit.dto;

import java.util.List;

/** 变换分类 + 顶层字段级差异 */
public record TransformationAnalysis(
        TransformationType type,
        List<String> fieldsAdded,
        List<String> fieldsRemoved,
        List<String> fieldsModified
) {}
