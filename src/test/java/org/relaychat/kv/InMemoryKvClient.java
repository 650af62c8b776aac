package org.relaychat.kv;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * KvClient en mémoire pour les tests, avec expiration pilotée par une horloge.
 */
public class InMemoryKvClient implements KvClient {

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final Clock clock;
    private final Map<String, Entry> values = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> hashes = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    public InMemoryKvClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = live(key);
        return e == null ? Optional.empty() : Optional.of(e.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        values.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void del(String key) {
        values.remove(key);
        hashes.remove(key);
        sets.remove(key);
    }

    @Override
    public void del(Collection<String> keys) {
        keys.forEach(this::del);
    }

    @Override
    public boolean exists(String key) {
        return live(key) != null || hashes.containsKey(key) || sets.containsKey(key);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Entry e = live(key);
        if (e == null || e.expiresAt() == null) return Optional.empty();
        return Optional.of(Duration.between(clock.instant(), e.expiresAt()));
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        List<String> out = new ArrayList<>();
        for (String key : values.keySet()) {
            if (out.size() >= limit) break;
            if (key.startsWith(prefix) && live(key) != null) out.add(key);
        }
        return out;
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        hashes.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).putAll(fields);
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return new LinkedHashMap<>(hashes.getOrDefault(key, Map.of()));
    }

    @Override
    public void sadd(String key, String member) {
        sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(member);
    }

    @Override
    public void srem(String key, String member) {
        Set<String> s = sets.get(key);
        if (s != null) s.remove(member);
    }

    @Override
    public Set<String> smembers(String key) {
        return Set.copyOf(sets.getOrDefault(key, Set.of()));
    }

    private Entry live(String key) {
        Entry e = values.get(key);
        if (e == null) return null;
        if (e.expired(clock.instant())) {
            values.remove(key, e);
            return null;
        }
        return e;
    }
}
