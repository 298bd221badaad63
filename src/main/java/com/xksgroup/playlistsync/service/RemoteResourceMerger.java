package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.dto.ResourceRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes how a remotely managed resource list maps onto the local one.
 * A remote entry matches a local resource by id, or by url and name together.
 */
@Component
public class RemoteResourceMerger {

    public record Update(PlaylistResource local, ResourceRequest remote) {
    }

    public record MergePlan(List<ResourceRequest> additions, List<Update> updates, List<PlaylistResource> removals) {

        public boolean isEmpty() {
            return additions.isEmpty() && updates.isEmpty() && removals.isEmpty();
        }
    }

    public MergePlan plan(List<PlaylistResource> local, List<ResourceRequest> remote, RemoteMergePolicy policy) {
        List<ResourceRequest> additions = new ArrayList<>();
        List<Update> updates = new ArrayList<>();

        for (ResourceRequest entry : remote) {
            PlaylistResource match = local.stream()
                    .filter(resource -> matches(resource, entry))
                    .findFirst()
                    .orElse(null);

            if (match == null) {
                boolean alreadyAdded = additions.stream().anyMatch(added -> sameEntry(added, entry));
                if (!alreadyAdded) {
                    additions.add(entry);
                }
            } else if (sourceChanged(match, entry)) {
                updates.add(new Update(match, entry));
            }
        }

        List<PlaylistResource> removals = new ArrayList<>();
        if (policy == RemoteMergePolicy.REPLACE) {
            for (PlaylistResource resource : local) {
                if (remote.stream().noneMatch(entry -> matches(resource, entry))) {
                    removals.add(resource);
                }
            }
        }
        return new MergePlan(additions, updates, removals);
    }

    static boolean matches(PlaylistResource resource, ResourceRequest entry) {
        if (entry.getId() != null && entry.getId().equals(resource.getId())) {
            return true;
        }
        return Objects.equals(resource.getUrl(), entry.getUrl()) && Objects.equals(resource.getName(), entry.getName());
    }

    private static boolean sameEntry(ResourceRequest a, ResourceRequest b) {
        if (a.getId() != null && a.getId().equals(b.getId())) {
            return true;
        }
        return Objects.equals(a.getUrl(), b.getUrl()) && Objects.equals(a.getName(), b.getName());
    }

    private static boolean sourceChanged(PlaylistResource resource, ResourceRequest entry) {
        return !Objects.equals(resource.getUrl(), entry.getUrl())
                || !Objects.equals(resource.getCredentials(), entry.getCredentials())
                || (entry.getType() != null && entry.getType() != resource.getType());
    }
}
