package com.metrics.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Cache service for aggregation results.
 * 
 * Uses Redis with circuit breaker for resilience.
 * 
 * Keys are the query kind plus the JSON form of the whole request, security
 * policy included, so two callers with different row filters never share
 * an entry.
 * 
 * Failure Handling:
 * - Circuit breaker prevents cascading failures
 * - Falls back to the backend on Redis failure
 * - Cache errors never fail a query
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {
    
    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    
    /**
     * Get cached query result.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String cached = redisTemplate.opsForValue().get(key);
            
            if (cached == null) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }
            
            return Optional.of(objectMapper.readValue(cached, type));
            
        } catch (JsonProcessingException e) {
            log.error("Error reading from cache: {}", e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * Store query result in cache.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
            log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
            
        } catch (JsonProcessingException e) {
            log.error("Error writing to cache: {}", e.getMessage());
        }
    }
    
    /**
     * Generate cache key from a query kind and its request object.
     */
    public String generateCacheKey(String prefix, Object request) {
        try {
            return prefix + ":" + objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Request is not serializable for caching", e);
        }
    }
    
    // Fallback methods (circuit breaker)
    
    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis circuit breaker open, falling back to backend: {}", e.getMessage());
        return Optional.empty();
    }
    
    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis circuit breaker open, skipping cache write: {}", e.getMessage());
    }
}
