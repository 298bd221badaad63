package com.xksgroup.playlistsync.model.dto;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Data
@Builder
public class SubscriberDto {
    private SseEmitter sseEmitter;

    // Empty to receive events of every resource
    private String resourceId;

    public boolean watches(String candidateId) {
        return resourceId == null || resourceId.isBlank() || resourceId.equals(candidateId);
    }
}
