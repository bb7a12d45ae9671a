package com.eainde.safepulse.voice;

import java.util.Optional;

public interface VoiceprintRepository {

    void save(Voiceprint voiceprint);

    Optional<Voiceprint> findByUserId(String userId);

    void delete(String userId);
}
