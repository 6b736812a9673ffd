package com.example.cloudsave.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

class CloudSaveConfigValidatorTest {

  private static final ValidatorFactory VALIDATOR_FACTORY =
      Validation.buildDefaultValidatorFactory();

  private final CloudSaveConfigValidator validator =
      new CloudSaveConfigValidator(VALIDATOR_FACTORY.getValidator());

  @AfterAll
  static void closeFactory() {
    VALIDATOR_FACTORY.close();
  }

  @Test
  void defaultsAreValidWithoutWarnings() {
    final ConfigValidationResult result = validator.validate(CloudSaveProperties.defaults());

    assertThat(result.isValid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings()).isEmpty();
  }

  @Test
  void enabledFirebaseRequiresCredentials() {
    final CloudSaveProperties config =
        config(
            "development",
            false,
            new CloudSaveProperties.Provider(
                ProviderType.FIREBASE,
                true,
                new CloudSaveProperties.Firebase(
                    "key", null, "demo", null, null, "app", null, null, null, null),
                null),
            null,
            null);

    final ConfigValidationResult result = validator.validate(config);

    assertThat(result.isValid()).isFalse();
    assertThat(result.errors())
        .containsExactly(
            "Firebase auth domain is required",
            "Firebase storage bucket is required",
            "Firebase messaging sender ID is required");
  }

  @Test
  void enabledSupabaseRequiresUrlAndAnonKey() {
    final CloudSaveProperties config =
        config(
            "development",
            false,
            new CloudSaveProperties.Provider(
                ProviderType.SUPABASE,
                true,
                null,
                new CloudSaveProperties.Supabase("https://example.supabase.co", " ", null, null)),
            null,
            null);

    assertThat(validator.validate(config).errors())
        .containsExactly("Supabase anonymous key is required");
  }

  @Test
  void productionRulesProduceErrorsAndWarnings() {
    final CloudSaveProperties config =
        config(
            "production",
            true,
            new CloudSaveProperties.Provider(
                ProviderType.FIREBASE,
                false,
                new CloudSaveProperties.Firebase(
                    null, null, null, null, null, null, null, true, null, null),
                null),
            new CloudSaveProperties.Features(null, null, null, null, null, true),
            new CloudSaveProperties.Settings(512L, null, 11, null));

    final ConfigValidationResult result = validator.validate(config);

    assertThat(result.errors()).containsExactly("Firebase emulator should not be used in production");
    assertThat(result.warnings())
        .containsExactly(
            "Maximum save size is very small (< 1KB)",
            "High retry attempts may cause performance issues",
            "Firebase emulator is enabled but no emulator host is configured",
            "Debug mode should be disabled in production",
            "Encryption is not supported yet; save data is stored without encryption");
  }

  @Test
  void beanValidationViolationsAreReportedWithTheirPath() {
    final CloudSaveProperties config =
        new CloudSaveProperties(
            "development",
            false,
            false,
            null,
            null,
            null,
            new CloudSaveProperties.Queue(100, 0, null, null, null, null, null, null),
            null,
            null);

    final ConfigValidationResult result = validator.validate(config);

    assertThat(result.isValid()).isFalse();
    assertThat(result.errors()).singleElement().asString().startsWith("queue.maxRetries: ");
  }

  private static CloudSaveProperties config(
      String environment,
      boolean debug,
      CloudSaveProperties.Provider provider,
      CloudSaveProperties.Features features,
      CloudSaveProperties.Settings settings) {
    return new CloudSaveProperties(
        environment, debug, false, provider, features, settings, null, null, null);
  }
}
