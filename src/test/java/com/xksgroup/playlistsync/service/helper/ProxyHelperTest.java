package com.xksgroup.playlistsync.service.helper;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyHelperTest {

    @Test
    void substitutesEncodedUrlIntoPlaceholder() {
        String proxied = ProxyHelper.buildProxyUrl("https://proxy.example/raw?url={url}", "http://host/list.m3u?a=1&b=2");

        assertThat(proxied).isEqualTo("https://proxy.example/raw?url=http%3A%2F%2Fhost%2Flist.m3u%3Fa%3D1%26b%3D2");
    }

    @Test
    void appendsEncodedUrlWhenTemplateHasNoPlaceholder() {
        assertThat(ProxyHelper.buildProxyUrl("https://proxy.example/?", "http://host/a b.m3u"))
                .isEqualTo("https://proxy.example/?http%3A%2F%2Fhost%2Fa+b.m3u");
    }
}
