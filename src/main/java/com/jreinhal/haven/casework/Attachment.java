package com.jreinhal.haven.casework;

/**
 * Stored file reference on a report. {@code type} is one of image, audio, document, other.
 */
public record Attachment(String url, String type, String filename) {
}
