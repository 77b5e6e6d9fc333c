package com.routelens.storage;

/** 录制数据库下的固定子目录。 */
public enum Namespace {
    SESSIONS("sessions"),
    LAYERS("layers"),
    AUDIT("audit"),
    PERFORMANCE("performance"),
    REPLAY("replay"),
    TRACES("traces"),
    LINEAGE("lineage"),
    TRANSFORMATIONS("transformations"),
    INDEXES("indexes");

    private final String dirName;

    Namespace(String dirName) {
        this.dirName = dirName;
    }

    public String dirName() {
        return dirName;
    }
}
