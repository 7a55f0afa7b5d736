package io.factorialsystems.oauthserver.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Audit publishing runs on its own pool so a slow broker never delays a token response.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    public static final String AUDIT_EXECUTOR = "auditExecutor";

    @Bean(name = AUDIT_EXECUTOR)
    public ThreadPoolTaskExecutor auditExecutor(OAuthServerProperties properties) {
        OAuthServerProperties.Audit audit = properties.getAudit();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(audit.getPublisherThreads());
        executor.setMaxPoolSize(audit.getMaxPublisherThreads());
        executor.setQueueCapacity(audit.getQueueCapacity());
        executor.setThreadNamePrefix("OAuthServer-Audit-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Audit backlog of {} events is full; dropping event", audit.getQueueCapacity()));
        executor.setWaitForTasksToCompleteOnShutdown(true);

        log.info("Audit executor configured with {} to {} publisher threads", audit.getPublisherThreads(),
                audit.getMaxPublisherThreads());
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Async audit call {} failed", method.getName(), ex);
    }
}
