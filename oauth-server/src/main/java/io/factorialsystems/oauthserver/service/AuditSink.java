package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.model.AuditEvent;

/**
 * Receives audit and security events. Implementations must not throw: a failing sink
 * never changes the outcome of the request that produced the event.
 */
public interface AuditSink {

    void record(AuditEvent event);
}
