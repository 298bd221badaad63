package com.xksgroup.playlistsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class PlaylistSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlaylistSyncApplication.class, args);
    }
}
