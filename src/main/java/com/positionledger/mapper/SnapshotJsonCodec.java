package com.positionledger.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.positionledger.domain.model.PositionSnapshot;
import com.positionledger.exception.ErrorCode;
import com.positionledger.exception.SnapshotFileException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON codec for the snapshot input and ledger output contracts.
 *
 * <p>Input is the array the position sync produces: snake_case keys, any subset of alias
 * fields, numbers possibly written as strings or as the bare tokens {@code NaN} /
 * {@code Infinity}. A numeric field holding anything unparseable reads as null (see
 * {@link LenientDoubleDeserializer}) and a null array element is kept for the pipeline to skip.
 * Unknown keys are ignored. Output uses snake_case keys and ISO-8601 dates.
 */
public final class SnapshotJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(SnapshotJsonCodec.class);

    private static final TypeReference<List<PositionSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .findAndAddModules()
            .addModule(new SimpleModule("lenient-snapshot-numbers")
                    .addDeserializer(Double.class, new LenientDoubleDeserializer()))
            .build();

    private SnapshotJsonCodec() {}

    /** Decodes a JSON array of snapshots. Returns an empty list for null or blank input. */
    public static List<PositionSnapshot> readSnapshots(String json) {
        return decode(json, "<inline>");
    }

    public static List<PositionSnapshot> readSnapshots(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read snapshot file {}", path, e);
            throw new SnapshotFileException(
                    ErrorCode.FILE_READ_ERROR, "Cannot read snapshot file", path.toString(), e);
        }
        return decode(json, path.toString());
    }

    private static List<PositionSnapshot> decode(String json, String source) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<PositionSnapshot> snapshots = OBJECT_MAPPER.readValue(json, SNAPSHOT_LIST);
            return snapshots != null ? snapshots : Collections.emptyList();
        } catch (JsonProcessingException e) {
            log.error("Failed to decode snapshot JSON from {}: {}", source, e.getOriginalMessage());
            throw new SnapshotFileException(
                    ErrorCode.INVALID_INPUT, "Snapshot input could not be decoded as a list of snapshots", source, e);
        }
    }

    /** Serializes any ledger value to snake_case JSON. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    public static void write(Path path, Object value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(value), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}", path, e);
            throw new SnapshotFileException(ErrorCode.FILE_WRITE_ERROR, "Cannot write ledger file", path.toString(), e);
        }
    }
}
