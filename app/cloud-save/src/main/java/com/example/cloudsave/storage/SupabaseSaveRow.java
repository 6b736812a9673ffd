package com.example.cloudsave.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Row of the {@code cloud_saves} table. {@code updatedAt} is ISO-8601 text. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
record SupabaseSaveRow(
    String ownerId,
    Integer slotNumber,
    String saveName,
    String payload,
    Boolean compressed,
    String checksum,
    String updatedAt) {}
