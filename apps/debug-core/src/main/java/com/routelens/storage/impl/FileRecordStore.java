package com.routelens.storage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.routelens.config.DebugDatabaseProperties;
import com.routelens.error.CorruptRecordException;
import com.routelens.error.NotFoundException;
import com.routelens.error.StorageIoException;
import com.routelens.storage.Namespace;
import com.routelens.storage.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

@Slf4j
@Service
public class FileRecordStore implements RecordStore {

    private static final String EXT = ".json";
    private static final String TMP_EXT = ".tmp";

    private final ObjectMapper om;
    private final ObjectWriter writer;
    private final Path root;

    public FileRecordStore(ObjectMapper om, DebugDatabaseProperties props) {
        this.om = om;
        this.writer = props.isPrettyPrint() ? om.writerWithDefaultPrettyPrinter() : om.writer();
        this.root = Paths.get(props.getRootPath()).toAbsolutePath().normalize();
    }

    @PostConstruct
    public void init() {
        ensureNamespaces();
        log.info("[STORE] FileRecordStore ready. root={}", root);
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Path resolve(Namespace namespace) {
        return root.resolve(namespace.dirName());
    }

    @Override
    public void ensureNamespaces() {
        for (Namespace ns : Namespace.values()) {
            Path dir = resolve(ns);
            try {
                // createDirectories 对已存在目录是幂等的，并发创建也不会报错
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StorageIoException("Failed to create namespace directory " + dir, e);
            }
        }
    }

    @Override
    public Path writeRecord(Namespace namespace, String filenameHint, Object record) {
        Path dir = resolve(namespace);
        Path target = dir.resolve(safe(filenameHint) + EXT);
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            byte[] bytes = writer.writeValueAsBytes(record);
            tmp = Files.createTempFile(dir, "." + safe(filenameHint) + "-", TMP_EXT);
            Files.write(tmp, bytes);
            moveAtomically(tmp, target);
            log.debug("[STORE] wrote {} ({} bytes)", target.getFileName(), bytes.length);
            return target;
        } catch (JsonProcessingException e) {
            throw new StorageIoException("Failed to serialize record for " + target, e);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageIoException("Failed to write record " + target, e);
        }
    }

    @Override
    public JsonNode readRecord(Path path) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw NotFoundException.record(String.valueOf(path));
        } catch (IOException e) {
            throw new StorageIoException("Failed to read record " + path, e);
        }
        try {
            JsonNode node = om.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new CorruptRecordException(path, new IllegalStateException("empty document"));
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException(path, e);
        }
    }

    @Override
    public <T> T readRecord(Path path, Class<T> type) {
        JsonNode node = readRecord(path);
        try {
            return om.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptRecordException(path, e);
        }
    }

    @Override
    public List<Path> listRecords(Namespace namespace, Predicate<String> fileNamePredicate) {
        Path dir = resolve(namespace);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(EXT) && !name.startsWith(".");
                    })
                    .filter(p -> fileNamePredicate == null || fileNamePredicate.test(p.getFileName().toString()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new StorageIoException("Failed to list namespace " + dir, e);
        }
    }

    // ---------- 内部 ----------

    private static void moveAtomically(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // 同目录下基本不会发生；退化为普通 move
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[STORE] failed to remove temp file {}: {}", tmp, e.toString());
        }
    }

    static String safe(String s) {
        if (s == null || s.isBlank()) return "record";
        return s.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
