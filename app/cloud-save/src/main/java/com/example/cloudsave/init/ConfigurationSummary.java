package com.example.cloudsave.init;

import com.example.cloudsave.config.ProviderType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Display summary. {@code status} is one of {@code ready}, {@code offline}, {@code not initialized}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConfigurationSummary(
    ProviderType provider, String status, List<String> features, int errors, int warnings) {}
