package io.durableproxy.client;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryRequestIdStore implements RequestIdStore {

    private final Map<String, RequestMapping> mappings = new ConcurrentHashMap<>();

    @Override
    public Optional<RequestMapping> load(String key) {
        return Optional.ofNullable(mappings.get(key));
    }

    @Override
    public void save(String key, RequestMapping mapping) {
        mappings.put(key, mapping);
    }

    @Override
    public void remove(String key) {
        mappings.remove(key);
    }
}
