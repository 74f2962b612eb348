package com.sahd.search.embed;

import com.sahd.search.cache.CacheKeyUtil;
import com.sahd.search.cache.TtlCache;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingCacheService {
    private final EmbeddingProperties properties;
    private final TtlCache<List<Double>> cache;

    public EmbeddingCacheService(EmbeddingProperties properties) {
        this.properties = properties;
        int maxEntries = properties.getCache() == null ? 2000 : properties.getCache().getMaxEntries();
        this.cache = new TtlCache<>(maxEntries);
    }

    public boolean isEnabled() {
        return properties.getCache() != null && properties.getCache().isEnabled();
    }

    public Optional<List<Double>> get(String text) {
        String key = buildKey(text);
        return key == null ? Optional.empty() : cache.get(key);
    }

    public void put(String text, List<Double> vector) {
        String key = buildKey(text);
        if (key == null || vector == null || vector.isEmpty()) {
            return;
        }
        cache.put(key, List.copyOf(vector), properties.getCache().getTtlMs());
    }

    // Text arrives normalized, so the key is the text itself scoped by mode and model.
    private String buildKey(String text) {
        if (!isEnabled() || text == null || text.isBlank()) {
            return null;
        }
        int maxLen = properties.getCache().getMaxTextLength();
        if (maxLen > 0 && text.length() > maxLen) {
            return null;
        }
        String model = properties.getModel() == null ? "" : properties.getModel();
        String mode = properties.getMode() == null ? "" : properties.getMode().name();
        return "embed:" + mode + ":" + model + ":" + CacheKeyUtil.sha256(text);
    }
}
