package com.xksgroup.playlistsync.service.helper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Consumes the body of one fetch attempt. The stream is closed by the fetcher.
 */
@FunctionalInterface
public interface StreamHandler<T> {

    T handle(InputStream body, FetchRoute route) throws IOException;
}
