package com.eainde.safepulse.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decouples state updates from collaborator I/O. Every hand-off runs on the dispatch
 * executor; a slow or failing collaborator is logged and never retried, and never
 * stalls signal ingestion.
 */
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final AlertNotifier alertNotifier;
    private final IncidentResponder incidentResponder;
    private final Executor executor;

    public AlertDispatcher(AlertNotifier alertNotifier, IncidentResponder incidentResponder, Executor executor) {
        this.alertNotifier = alertNotifier;
        this.incidentResponder = incidentResponder;
        this.executor = executor;
    }

    public void alert(AlertEvent event) {
        dispatch(event.domain().name(), "alert", () -> alertNotifier.notify(event));
    }

    public void respond(AlertEvent event) {
        dispatch(event.domain().name(), "incident response", () -> incidentResponder.respond(event));
    }

    /**
     * Runs {@code action} asynchronously with {@code domain} in the MDC.
     */
    public void dispatch(String domain, String description, Runnable action) {
        MDC.put("domain", domain);
        try {
            executor.execute(() -> {
                try {
                    action.run();
                    log.debug("Delivered {} for {}", description, domain);
                } catch (RuntimeException e) {
                    log.error("Collaborator failed during {} for {}", description, domain, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Dispatch executor rejected {} for {}", description, domain, e);
        } finally {
            MDC.remove("domain");
        }
    }
}
