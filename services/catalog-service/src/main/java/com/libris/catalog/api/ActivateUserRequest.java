package com.libris.catalog.api;

public record ActivateUserRequest(String token) {}
