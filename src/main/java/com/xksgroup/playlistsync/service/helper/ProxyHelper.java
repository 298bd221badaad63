package com.xksgroup.playlistsync.service.helper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class ProxyHelper {

    public static final String URL_PLACEHOLDER = "{url}";

    /**
     * Build the fallback URL for a source by substituting the encoded source URL
     * into the template. A template without placeholder gets the URL appended.
     */
    public static String buildProxyUrl(String template, String sourceUrl) {
        String encoded = URLEncoder.encode(sourceUrl, StandardCharsets.UTF_8);

        if (template.contains(URL_PLACEHOLDER)) {
            return template.replace(URL_PLACEHOLDER, encoded);
        }
        return template + encoded;
    }
}
