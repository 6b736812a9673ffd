package com.example.cloudsave.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SaveReceipt(
    String provider,
    String ownerId,
    int slotNumber,
    String checksum,
    boolean compressed,
    long storedBytes,
    Instant updatedAt) {}
