package com.xksgroup.playlistsync.service.provider;

import com.xksgroup.playlistsync.model.ProviderCatalog;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.service.sync.CancellationToken;

/**
 * Structured provider API returning a whole catalog in one bulk fetch.
 */
public interface ProviderClient {

    /**
     * Fetch categories and streams of every section and categorize them.
     *
     * @throws com.xksgroup.playlistsync.exception.PlaylistFetchException when no section could be fetched
     * @throws com.xksgroup.playlistsync.exception.SyncCancelledException when {@code token} was cancelled
     */
    ProviderCatalog fetchAll(ProviderCredentials credentials, CancellationToken token);

    /**
     * @throws com.xksgroup.playlistsync.exception.ProviderAuthenticationException when the provider rejects the credentials
     */
    void authenticate(ProviderCredentials credentials);
}
