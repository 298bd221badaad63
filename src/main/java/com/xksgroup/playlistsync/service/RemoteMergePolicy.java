package com.xksgroup.playlistsync.service;

public enum RemoteMergePolicy {
    MERGE,      // Add and update, never delete local resources
    REPLACE     // Remote list is authoritative, local resources missing from it are deleted
}
