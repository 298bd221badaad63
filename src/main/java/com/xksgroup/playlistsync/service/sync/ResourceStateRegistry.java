package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.model.ResourceState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the runtime {@link ResourceState} of every known resource. Nothing here is persisted.
 */
@Component
public class ResourceStateRegistry {

    private final Map<String, ResourceState> states = new ConcurrentHashMap<>();

    public ResourceState get(String resourceId) {
        return states.computeIfAbsent(resourceId, ResourceState::new);
    }

    public Optional<ResourceState> find(String resourceId) {
        return Optional.ofNullable(states.get(resourceId));
    }

    public void remove(String resourceId) {
        states.remove(resourceId);
    }

    public List<ResourceState> snapshots() {
        List<ResourceState> copies = new ArrayList<>();
        states.values().forEach(state -> copies.add(state.snapshot()));
        return copies;
    }

    public void clear() {
        states.clear();
    }
}
