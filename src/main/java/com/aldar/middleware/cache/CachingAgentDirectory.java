package com.aldar.middleware.cache;

import com.aldar.middleware.transcript.source.AgentDirectory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-through cache in front of an {@link AgentDirectory}. Only hits are cached, so an
 * agent registered after a miss is visible on the next read.
 */
public class CachingAgentDirectory implements AgentDirectory {

    private final AgentDirectory delegate;
    private final ExpiringCache<String, String> namesById;
    private final ExpiringCache<String, String> idsByName;

    public CachingAgentDirectory(
            AgentDirectory delegate,
            ExpiringCache<String, String> namesById,
            ExpiringCache<String, String> idsByName
    ) {
        this.delegate = delegate;
        this.namesById = namesById;
        this.idsByName = idsByName;
    }

    @Override
    public Map<String, String> resolveAgentNames(Collection<String> agentIds) {
        Map<String, String> names = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        if (agentIds == null) {
            return names;
        }
        for (String agentId : agentIds) {
            if (agentId == null) {
                continue;
            }
            Optional<String> cached = namesById.get(agentId);
            if (cached.isPresent()) {
                names.put(agentId, cached.get());
            } else {
                missing.add(agentId);
            }
        }
        if (!missing.isEmpty()) {
            Map<String, String> loaded = delegate.resolveAgentNames(missing);
            loaded.forEach((id, name) -> {
                namesById.put(id, name);
                names.put(id, name);
            });
        }
        return names;
    }

    @Override
    public Optional<String> findAgentIdByName(String agentName) {
        if (agentName == null || agentName.isBlank()) {
            return Optional.empty();
        }
        String key = agentName.trim().toLowerCase(Locale.ROOT);
        Optional<String> cached = idsByName.get(key);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<String> loaded = delegate.findAgentIdByName(agentName);
        loaded.ifPresent(id -> idsByName.put(key, id));
        return loaded;
    }
}
