package com.xksgroup.playlistsync.parser;

/**
 * Attributes pulled out of one #EXTINF line. Null fields were absent on the line.
 */
record ExtinfMetadata(String title, String logo, String group, String id) {
}
