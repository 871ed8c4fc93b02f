package com.libris.catalog.api;

public record RegisterUserRequest(String name, String email, String password) {}
