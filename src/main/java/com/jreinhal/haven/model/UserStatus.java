package com.jreinhal.haven.model;

public enum UserStatus {
    PENDING,
    APPROVED,
    REJECTED
}
