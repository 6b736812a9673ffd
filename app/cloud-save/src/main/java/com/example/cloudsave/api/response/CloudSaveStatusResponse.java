package com.example.cloudsave.api.response;

import com.example.cloudsave.init.ConfigurationSummary;
import com.example.cloudsave.init.InitializationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code network} is null when network monitoring is disabled or services are not running. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CloudSaveStatusResponse(
    boolean ready,
    ConfigurationSummary summary,
    InitializationStatus initialization,
    NetworkStatusResponse network) {}
