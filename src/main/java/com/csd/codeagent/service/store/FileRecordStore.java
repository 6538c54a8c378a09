package com.csd.codeagent.service.store;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * One JSON file per record under {@code <directory>/<namespace>/<key>.json}.
 * File I/O runs on the bounded-elastic scheduler.
 */
@Slf4j
public class FileRecordStore implements RecordStore {

    private final Path root;

    public FileRecordStore(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.error("Failed to create record store directory {}", root, e);
        }
    }

    @Override
    public Mono<Void> upsert(String namespace, String key, String json) {
        return Mono.<Void>fromCallable(() -> {
            Path file = fileFor(namespace, key);
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, json, StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return null;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> find(String namespace, String key) {
        return Mono.fromCallable(() -> {
            Path file = fileFor(namespace, key);
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String namespace, String key) {
        return Mono.<Void>fromCallable(() -> {
            Files.deleteIfExists(fileFor(namespace, key));
            return null;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    Path fileFor(String namespace, String key) {
        return root.resolve(safe(namespace)).resolve(safe(key) + ".json");
    }

    private static String safe(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
