package com.hhplus.orderengine.domain.enums;

public enum UserRole {
    USER,
    ADMIN
}
