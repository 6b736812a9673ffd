package com.example.cloudsave.storage;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CloudSaveSummary(int slotNumber, String saveName, String checksum, Instant updatedAt) {}
