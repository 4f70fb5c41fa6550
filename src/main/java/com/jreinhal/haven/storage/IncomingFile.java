package com.jreinhal.haven.storage;

/**
 * An accepted upload held in memory between policy check and storage.
 */
public record IncomingFile(String fieldName, String originalFilename, String contentType, byte[] data) {

    public boolean isAudio() {
        return "audio".equals(FileStorageService.classify(contentType));
    }

    public long size() {
        return data == null ? 0 : data.length;
    }
}
