package com.jreinhal.haven.storage;

/**
 * A persisted file and the URL it is served from.
 */
public record StoredFile(String url, String type, String filename, String contentType, long size) {
}
