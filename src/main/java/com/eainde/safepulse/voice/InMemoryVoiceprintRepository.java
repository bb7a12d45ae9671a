package com.eainde.safepulse.voice;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryVoiceprintRepository implements VoiceprintRepository {

    private final Map<String, Voiceprint> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Voiceprint voiceprint) {
        storage.put(voiceprint.userId(), voiceprint);
    }

    @Override
    public Optional<Voiceprint> findByUserId(String userId) {
        return Optional.ofNullable(storage.get(userId));
    }

    @Override
    public void delete(String userId) {
        storage.remove(userId);
    }
}
