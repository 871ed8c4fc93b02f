package com.libris.catalog.api;

public record LoginRequest(String email, String password) {}
