package com.prism.service.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.prism.service.core.config.QueryProperties;
import java.util.Iterator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CaffeineQueryResultStore implements QueryResultStore {

    private final Cache<String, Object> entries;

    public CaffeineQueryResultStore(QueryProperties properties) {
        QueryProperties.Cache config = properties.getCache();
        this.entries = Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfterWrite(config.getTtl())
                .recordStats()
                .build();
        log.info("Initialized query result cache size={} ttl={}.", config.getMaximumSize(), config.getTtl());
    }

    @Override
    public <T> T get(String key, Class<T> type) {
        Object value = entries.getIfPresent(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    @Override
    public void put(String key, Object value) {
        entries.put(key, value);
    }

    @Override
    public int sweep(String prefix) {
        int removed = 0;
        Iterator<String> keys = entries.asMap().keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} cached results under {}", removed, prefix);
        }
        return removed;
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
