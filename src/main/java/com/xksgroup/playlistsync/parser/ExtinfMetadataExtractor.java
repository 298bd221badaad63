package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.model.PlaylistItem;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads title and key="value" attributes from an #EXTINF metadata line.
 */
final class ExtinfMetadataExtractor {

    private static final Pattern ATTRIBUTE = Pattern.compile("([a-zA-Z0-9\\-]+)=\"([^\"]*)\"");

    private ExtinfMetadataExtractor() {
    }

    static ExtinfMetadata extract(String line) {
        // Title follows the last comma, attributes may contain commas themselves
        int lastComma = line.lastIndexOf(',');
        String title = line.substring(lastComma + 1).trim();

        String logo = null;
        String group = null;
        String id = null;

        Matcher matcher = ATTRIBUTE.matcher(line);
        while (matcher.find()) {
            String key = matcher.group(1).toLowerCase(Locale.ROOT);
            String value = matcher.group(2);
            switch (key) {
                case "tvg-logo":
                    logo = value;
                    break;
                case "group-title":
                    group = value;
                    break;
                case "tvg-id":
                    id = value;
                    break;
                default:
                    break;
            }
        }

        if (group == null || group.isEmpty()) {
            group = PlaylistItem.DEFAULT_GROUP;
        }
        return new ExtinfMetadata(title, logo, group, id);
    }
}
