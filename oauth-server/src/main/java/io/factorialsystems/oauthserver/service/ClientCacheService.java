package io.factorialsystems.oauthserver.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.factorialsystems.oauthserver.model.OAuthClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis read-through cache for resolved clients. Any failure degrades to a cache miss.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientCacheService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    private static final String CLIENT_KEY_PREFIX = "oauth:client:";
    private static final Duration CLIENT_TTL = Duration.ofMinutes(10);

    public void cacheClient(OAuthClient client) {
        if (client == null) return;

        try {
            String clientJson = objectMapper.writeValueAsString(client);
            redisTemplate.opsForValue().set(CLIENT_KEY_PREFIX + client.getClientId(), clientJson, CLIENT_TTL);
            log.debug("Cached OAuth client: {} with TTL: {}", client.getClientId(), CLIENT_TTL);

        } catch (JsonProcessingException e) {
            log.error("Failed to serialize OAuth client for caching: {}", client.getClientId(), e);
        } catch (Exception e) {
            log.warn("Failed to cache OAuth client {}: {}", client.getClientId(), e.getMessage());
        }
    }

    public OAuthClient getCachedClient(String clientId) {
        if (clientId == null) return null;

        try {
            String clientJson = redisTemplate.opsForValue().get(CLIENT_KEY_PREFIX + clientId);
            if (clientJson != null) {
                log.debug("Cache hit for OAuth client: {}", clientId);
                return objectMapper.readValue(clientJson, OAuthClient.class);
            }

            log.debug("Cache miss for OAuth client: {}", clientId);
            return null;

        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize cached OAuth client: {}", clientId, e);
            return null;
        } catch (Exception e) {
            log.warn("Failed to read cached OAuth client {}: {}", clientId, e.getMessage());
            return null;
        }
    }

    public void evictClient(String clientId) {
        if (clientId == null) return;

        try {
            redisTemplate.delete(CLIENT_KEY_PREFIX + clientId);
            log.debug("Evicted OAuth client cache: {}", clientId);
        } catch (Exception e) {
            log.warn("Failed to evict OAuth client {} from cache: {}", clientId, e.getMessage());
        }
    }
}
