package io.factorialsystems.oauthserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Audit events go to a topic exchange; security events get their own queue so alerting can
 * consume them without the regular audit stream.
 */
@Configuration
@RequiredArgsConstructor
public class RabbitMQConfig {

    private final OAuthServerProperties properties;

    @Bean
    public TopicExchange auditExchange() {
        return new TopicExchange(properties.getAudit().getExchange());
    }

    @Bean
    public Queue auditQueue() {
        return new Queue(properties.getAudit().getAuditQueue(), true);
    }

    @Bean
    public Queue securityQueue() {
        return new Queue(properties.getAudit().getSecurityQueue(), true);
    }

    @Bean
    public Binding auditBinding(TopicExchange auditExchange) {
        return BindingBuilder
                .bind(auditQueue())
                .to(auditExchange)
                .with(properties.getAudit().getAuditRoutingKey());
    }

    @Bean
    public Binding securityBinding(TopicExchange auditExchange) {
        return BindingBuilder
                .bind(securityQueue())
                .to(auditExchange)
                .with(properties.getAudit().getSecurityRoutingKey());
    }

    @Bean
    public MessageConverter converter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter converter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(converter);
        return rabbitTemplate;
    }
}
