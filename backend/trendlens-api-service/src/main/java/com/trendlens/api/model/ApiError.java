package com.trendlens.api.model;

public record ApiError(String code, String message) {
}
