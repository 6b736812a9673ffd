package com.example.cloudsave.init;

public record InitializationProgress(String step, int percent) {}
