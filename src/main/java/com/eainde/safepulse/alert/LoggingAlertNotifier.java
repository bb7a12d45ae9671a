package com.eainde.safepulse.alert;

import com.eainde.safepulse.truthlock.EvidenceReleaseNotifier;
import com.eainde.safepulse.truthlock.ReleaseNotice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default collaborator used when the host application registers none: writes the
 * alert, autonomous response and evidence release payloads to the log as JSON.
 */
public class LoggingAlertNotifier implements AlertNotifier, IncidentResponder, EvidenceReleaseNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    private final ObjectMapper objectMapper;

    public LoggingAlertNotifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void notify(AlertEvent event) {
        log.warn("ALERT {} level={} score={} payload={}",
                event.domain(), event.level(), event.score(), safeSerialize(event));
    }

    @Override
    public void respond(AlertEvent event) {
        log.warn("AUTONOMOUS RESPONSE {} level={} score={}", event.domain(), event.level(), event.score());
    }

    @Override
    public void release(ReleaseNotice notice) {
        log.warn("EVIDENCE RELEASE lock={} incident={} outcome={} items={} payload={}",
                notice.lockId(), notice.incidentId(), notice.outcome(), notice.evidenceCount(), safeSerialize(notice));
    }

    private String safeSerialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return value.toString(); // fallback to toString rather than failing
        }
    }
}
