package io.factorialsystems.oauthserver.config;

import io.factorialsystems.oauthserver.model.AuditEvent;
import io.factorialsystems.oauthserver.service.RabbitAuditSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void auditExecutor_isSizedFromAuditProperties() {
        OAuthServerProperties properties = new OAuthServerProperties();
        properties.getAudit().setPublisherThreads(3);
        properties.getAudit().setMaxPublisherThreads(7);

        executor = new AsyncConfig().auditExecutor(properties);
        executor.initialize();

        assertEquals(3, executor.getCorePoolSize());
        assertEquals(7, executor.getMaxPoolSize());
        assertEquals("OAuthServer-Audit-", executor.getThreadNamePrefix());
    }

    @Test
    void auditExecutor_dropsEventsWhenTheBacklogIsFull() throws Exception {
        OAuthServerProperties properties = new OAuthServerProperties();
        properties.getAudit().setPublisherThreads(1);
        properties.getAudit().setMaxPublisherThreads(1);
        properties.getAudit().setQueueCapacity(1);
        executor = new AsyncConfig().auditExecutor(properties);
        executor.initialize();

        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger published = new AtomicInteger();
        Runnable blocking = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            published.incrementAndGet();
        };

        executor.execute(blocking);
        executor.execute(published::incrementAndGet);
        assertDoesNotThrow(() -> executor.execute(published::incrementAndGet));

        release.countDown();
        executor.getThreadPoolExecutor().shutdown();
        assertTrue(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(2, published.get());
    }

    @Test
    void rabbitAuditSink_publishesOnTheAuditExecutor() throws Exception {
        Async async = RabbitAuditSink.class.getMethod("record", AuditEvent.class).getAnnotation(Async.class);

        assertNotNull(async);
        assertEquals(AsyncConfig.AUDIT_EXECUTOR, async.value());
    }
}
