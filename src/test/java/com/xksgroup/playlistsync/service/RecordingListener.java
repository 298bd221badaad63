package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.service.sync.SyncEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

class RecordingListener implements SyncEventListener {

    final List<PlaylistStats> progress = new CopyOnWriteArrayList<>();
    final List<ResourceState> rendered = new CopyOnWriteArrayList<>();
    final List<ResourceState> finished = new CopyOnWriteArrayList<>();
    final CountDownLatch itemsSeen = new CountDownLatch(1);

    @Override
    public void onStatusUpdate(String resourceId, PlaylistStats stats) {
        progress.add(stats);
        if (stats.total() > 0) {
            itemsSeen.countDown();
        }
    }

    @Override
    public void onRender(ResourceState state) {
        rendered.add(state);
    }

    @Override
    public void onSyncFinished(ResourceState state) {
        finished.add(state);
    }
}
