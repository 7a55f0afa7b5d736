package io.factorialsystems.oauthserver.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.factorialsystems.oauthserver.model.OAuthClient;
import io.factorialsystems.oauthserver.model.TokenEndpointAuthMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClientCacheServiceTest {

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ClientCacheService clientCacheService;

    @BeforeEach
    void setUp() {
        clientCacheService = new ClientCacheService(redisTemplate, new ObjectMapper().findAndRegisterModules());
    }

    private static OAuthClient client() {
        return OAuthClient.builder()
                .id("id-1")
                .clientId("c1")
                .clientSecretHash("{bcrypt}hash")
                .clientName("c1 app")
                .isConfidential(true)
                .isEnabled(true)
                .tokenEndpointAuthMethod(TokenEndpointAuthMethod.CLIENT_SECRET_BASIC)
                .redirectUris(List.of("https://app/cb"))
                .grantTypes(List.of("authorization_code"))
                .scopes(List.of("read"))
                .createdAt(OffsetDateTime.parse("2026-01-15T10:00:00Z"))
                .build();
    }

    @Test
    void cacheClient_storesJsonWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        clientCacheService.cacheClient(client());

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("oauth:client:c1"), json.capture(), eq(Duration.ofMinutes(10)));
        assertTrue(json.getValue().contains("\"clientId\":\"c1\""));
    }

    @Test
    void getCachedClient_readsBackWhatWasCached() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        clientCacheService.cacheClient(client());
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(anyString(), json.capture(), any(Duration.class));
        when(valueOperations.get("oauth:client:c1")).thenReturn(json.getValue());

        OAuthClient cached = clientCacheService.getCachedClient("c1");

        assertNotNull(cached);
        assertEquals("c1", cached.getClientId());
        assertEquals(TokenEndpointAuthMethod.CLIENT_SECRET_BASIC, cached.getTokenEndpointAuthMethod());
        assertEquals(List.of("read"), cached.getScopes());
        assertTrue(cached.isConfidentialClient());
    }

    @Test
    void getCachedClient_missReturnsNull() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("oauth:client:c1")).thenReturn(null);

        assertNull(clientCacheService.getCachedClient("c1"));
    }

    @Test
    void getCachedClient_redisFailureDegradesToMiss() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertNull(clientCacheService.getCachedClient("c1"));
    }

    @Test
    void evictClient_deletesTheKey() {
        clientCacheService.evictClient("c1");

        verify(redisTemplate).delete("oauth:client:c1");
    }
}
