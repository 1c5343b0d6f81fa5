package com.keystone.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * JSON documents on the local filesystem.
 * <p>
 * Every persisted document of a workflow goes through this class. Mutable documents are
 * replaced atomically (write to a sibling temp file, then move over the target) so readers
 * never observe a half-written file; append-only documents are created with
 * {@code CREATE_NEW} and are never rewritten.
 */
@Component
public class JsonDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final ObjectMapper mapper;

    public JsonDocumentStore() {
        this.mapper = createMapper();
    }

    public static ObjectMapper createMapper() {
        var mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Atomically writes (or replaces) a document.
     */
    public void write(Path target, Object document) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), document);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    /**
     * Creates an append-only document.
     *
     * @return false if the document already exists; it is left untouched
     */
    public boolean writeNew(Path target, Object document) {
        try {
            Files.createDirectories(target.getParent());
            byte[] bytes = mapper.writeValueAsBytes(document);
            Files.write(target, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Append-only document {} already exists", target);
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + target, e);
        }
    }

    /**
     * Creates an append-only text file holding raw content that may not be valid JSON.
     *
     * @return false if the file already exists; it is left untouched
     */
    public boolean writeNewText(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Append-only file {} already exists", target);
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + target, e);
        }
    }

    public Optional<String> readText(Path source) {
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(source, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    public <T> Optional<T> read(Path source, Class<T> type) {
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(source.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    public <T> Optional<T> read(Path source, TypeReference<T> type) {
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(source.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    public Optional<JsonNode> readTree(Path source) {
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(source.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    /**
     * Appends one compact JSON line to a {@code .jsonl} file.
     */
    public synchronized void appendLine(Path target, Object document) {
        try {
            Files.createDirectories(target.getParent());
            String line = mapper.writer().without(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(document) + System.lineSeparator();
            Files.writeString(target, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + target, e);
        }
    }

    public List<JsonNode> readLines(Path source) {
        if (!Files.isRegularFile(source)) {
            return List.of();
        }
        try {
            var nodes = new ArrayList<JsonNode>();
            for (String line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    nodes.add(mapper.readTree(line));
                }
            }
            return nodes;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
    }

    /**
     * Regular files directly inside {@code dir} whose names end with {@code suffix}, sorted by name.
     */
    public List<Path> list(Path dir, String suffix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    public List<Path> listDirectories(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
