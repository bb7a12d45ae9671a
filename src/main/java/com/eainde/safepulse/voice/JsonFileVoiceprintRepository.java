package com.eainde.safepulse.voice;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores each voiceprint as {@code voiceprint_<userId>.json} in a directory.
 */
public class JsonFileVoiceprintRepository implements VoiceprintRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileVoiceprintRepository.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileVoiceprintRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(Voiceprint voiceprint) {
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(fileFor(voiceprint.userId()).toFile(), voiceprint);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write voiceprint for user " + voiceprint.userId(), e);
        }
    }

    @Override
    public Optional<Voiceprint> findByUserId(String userId) {
        Path file = fileFor(userId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Voiceprint.class));
        } catch (IOException e) {
            // corrupt file: treated as not enrolled
            log.error("Failed to load voiceprint for user {} from {}", userId, file, e);
            return Optional.empty();
        }
    }

    @Override
    public void delete(String userId) {
        try {
            Files.deleteIfExists(fileFor(userId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete voiceprint for user " + userId, e);
        }
    }

    private Path fileFor(String userId) {
        String safeId = userId.replaceAll("[^A-Za-z0-9_-]", "_");
        return directory.resolve("voiceprint_" + safeId + ".json");
    }
}
