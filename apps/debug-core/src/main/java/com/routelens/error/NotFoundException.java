package com.routelens.error;

import lombok.Getter;

/** 未知的 trace / session / record 标识。 */
@Getter
public class NotFoundException extends DebugDataException {

    public enum Kind { TRACE, SESSION, RECORD }

    private final Kind kind;
    private final String identifier;

    public NotFoundException(Kind kind, String identifier) {
        super(kind.name().charAt(0) + kind.name().substring(1).toLowerCase() + " " + identifier + " not found");
        this.kind = kind;
        this.identifier = identifier;
    }

    public static NotFoundException trace(String traceId) {
        return new NotFoundException(Kind.TRACE, traceId);
    }

    public static NotFoundException session(String sessionId) {
        return new NotFoundException(Kind.SESSION, sessionId);
    }

    public static NotFoundException record(String pathOrId) {
        return new NotFoundException(Kind.RECORD, pathOrId);
    }
}
