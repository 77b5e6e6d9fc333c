package com.routelens.storage;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * 一条事件一个 JSON 文件的录制库。
 * 所有 IO 失败都以 {@link com.routelens.error.DebugDataException} 子类抛给调用方。
 */
public interface RecordStore {

    /** 根目录 */
    Path root();

    /** 某个命名空间对应的目录 */
    Path resolve(Namespace namespace);

    /** 确保所有命名空间目录存在（幂等，可并发调用） */
    void ensureNamespaces();

    /**
     * 序列化并写入新文件；先写临时文件再原子改名，读者永远看不到半个文件。
     * @param filenameHint 不含扩展名的文件名，非法字符会被替换
     * @return 实际写入的路径
     */
    Path writeRecord(Namespace namespace, String filenameHint, Object record);

    /** 读成树；文件不存在抛 NotFound，解析失败抛 Corrupt */
    JsonNode readRecord(Path path);

    /** 读成指定类型 */
    <T> T readRecord(Path path, Class<T> type);

    /** 按文件名过滤列出记录，按文件名排序 */
    List<Path> listRecords(Namespace namespace, Predicate<String> fileNamePredicate);
}
