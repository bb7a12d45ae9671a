package com.eainde.safepulse.alert;

/**
 * Alerting collaborator: contacts emergency contacts, pushes notifications.
 * Delivery retries are its own concern.
 */
@FunctionalInterface
public interface AlertNotifier {

    void notify(AlertEvent event);
}
