package com.xksgroup.playlistsync.model.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class HealthDto {
    private String status;
    private boolean mongoReachable;
    private String mongoError;
    private int activeSyncs;
    private int sseSubscribers;
    private long resources;

    // resource id -> committed chunk count
    private Map<String, Long> chunkCounts;
}
