package org.relaychat.kv;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public void del(Collection<String> keys) {
        if (keys.isEmpty()) return;
        redis.delete(keys);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long seconds = redis.getExpire(key);
        if (seconds == null || seconds < 0) return Optional.empty();
        return Optional.of(Duration.ofSeconds(seconds));
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(Math.max(limit, 100)).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext() && keys.size() < limit) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        redis.opsForHash().putAll(key, fields);
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    @Override
    public void sadd(String key, String member) {
        redis.opsForSet().add(key, member);
    }

    @Override
    public void srem(String key, String member) {
        redis.opsForSet().remove(key, member);
    }

    @Override
    public Set<String> smembers(String key) {
        Set<String> members = redis.opsForSet().members(key);
        return members == null ? Set.of() : members;
    }
}
