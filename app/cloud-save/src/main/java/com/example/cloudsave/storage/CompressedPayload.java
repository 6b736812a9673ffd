package com.example.cloudsave.storage;

/**
 * @param data Base64 text when {@code compressed}, otherwise the original JSON
 */
public record CompressedPayload(String data, boolean compressed, int originalSize, int storedSize) {}
