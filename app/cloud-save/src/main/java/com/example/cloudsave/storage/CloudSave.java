package com.example.cloudsave.storage;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record CloudSave(
    String ownerId,
    int slotNumber,
    String saveName,
    JsonNode gameState,
    String checksum,
    Instant updatedAt) {}
