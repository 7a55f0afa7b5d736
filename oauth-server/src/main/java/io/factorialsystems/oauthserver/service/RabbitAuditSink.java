package io.factorialsystems.oauthserver.service;

import io.factorialsystems.oauthserver.config.AsyncConfig;
import io.factorialsystems.oauthserver.config.OAuthServerProperties;
import io.factorialsystems.oauthserver.model.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RabbitAuditSink implements AuditSink {

    private final RabbitTemplate rabbitTemplate;
    private final OAuthServerProperties properties;

    /**
     * Publish the event to the audit exchange; security events go to their own routing key
     */
    @Async(AsyncConfig.AUDIT_EXECUTOR)
    @Override
    public void record(AuditEvent event) {
        OAuthServerProperties.Audit audit = properties.getAudit();
        String routingKey = event.isSecurityEvent() ? audit.getSecurityRoutingKey() : audit.getAuditRoutingKey();

        try {
            rabbitTemplate.convertAndSend(audit.getExchange(), routingKey, event);

            log.debug("Published audit event: exchange={}, routingKey={}, type={}",
                    audit.getExchange(), routingKey, event.getEventType());

        } catch (Exception e) {
            // Audit delivery failures are not allowed to fail the grant
            log.error("Failed to publish audit event {} for client {}", event.getEventType(), event.getClientId(), e);
        }
    }
}
