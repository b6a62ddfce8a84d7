package com.hhplus.orderengine.presentation.dto;

public record MessageResponse(
        String message
) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
