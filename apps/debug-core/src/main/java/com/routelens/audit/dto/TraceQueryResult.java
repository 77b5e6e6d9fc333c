package com.routelens.audit.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** 查询命中的 trace（拷贝），includeLineage 时附带现算的血缘 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceQueryResult(Trace trace, Lineage lineage) {}
