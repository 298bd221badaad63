package com.xksgroup.playlistsync.model.dto;

import com.xksgroup.playlistsync.service.RemoteMergePolicy;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

@Data
@Builder
public class RemoteMergeResult {
    private RemoteMergePolicy policy;

    @Singular("added")
    private List<String> added;

    @Singular("updated")
    private List<String> updated;

    @Singular("removed")
    private List<String> removed;

    public boolean isChanged() {
        return !added.isEmpty() || !updated.isEmpty() || !removed.isEmpty();
    }
}
