package com.nfltrends.api.dto;

public record MessageResponse(String message) {
}
