package com.eainde.safepulse.alert;

/**
 * Autonomous response collaborator: opens an incident and primes recording when the
 * core acts on its own (autonomous danger mode, confirmed intent).
 */
@FunctionalInterface
public interface IncidentResponder {

    void respond(AlertEvent event);
}
