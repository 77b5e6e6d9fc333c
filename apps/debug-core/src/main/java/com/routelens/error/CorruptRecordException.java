package com.routelens.error;

import lombok.Getter;

import java.nio.file.Path;

/** 持久化文件存在，但无法解析为 JSON 记录。 */
@Getter
public class CorruptRecordException extends DebugDataException {
    private final Path path;

    public CorruptRecordException(Path path, Throwable cause) {
        super("Corrupt record file " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }
}
