package com.libris.catalog.api;

/**
 * Body of {@code POST /books} and {@code PATCH /books/{id}}. For PATCH, absent fields stay
 * unchanged.
 */
public record BookRequest(String title, String author, Integer publishedYear) {}
