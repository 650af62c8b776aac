package org.relaychat.kv;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accès clé/valeur (Redis en production, mémoire en test).
 */
public interface KvClient {
    Optional<String> get(String key);
    void set(String key, String value, Duration ttl);
    void del(String key);
    void del(Collection<String> keys);
    boolean exists(String key);
    Optional<Duration> ttl(String key);
    List<String> scan(String prefix, int limit);

    void hset(String key, Map<String, String> fields);
    Map<String, String> hgetAll(String key);

    void sadd(String key, String member);
    void srem(String key, String member);
    Set<String> smembers(String key);
}
