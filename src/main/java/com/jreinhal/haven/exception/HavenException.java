package com.jreinhal.haven.exception;

public class HavenException extends RuntimeException {
    private final ErrorKind kind;

    public HavenException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return this.kind;
    }

    public static HavenException unauthenticated(String message) {
        return new HavenException(ErrorKind.UNAUTHENTICATED, message);
    }

    public static HavenException permissionDenied(String message) {
        return new HavenException(ErrorKind.PERMISSION_DENIED, message);
    }

    public static HavenException notFound(String message) {
        return new HavenException(ErrorKind.NOT_FOUND, message);
    }

    public static HavenException conflict(String message) {
        return new HavenException(ErrorKind.CONFLICT, message);
    }

    public static HavenException invalidArgument(String message) {
        return new HavenException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static HavenException invalidState(String message) {
        return new HavenException(ErrorKind.INVALID_STATE, message);
    }

    public static HavenException failedPrecondition(String message) {
        return new HavenException(ErrorKind.FAILED_PRECONDITION, message);
    }

    public static HavenException archivedImmutable(String message) {
        return new HavenException(ErrorKind.ARCHIVED_IMMUTABLE, message);
    }
}
