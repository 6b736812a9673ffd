/*
 * どこで: Cloud Save 設定検証
 * 何を: Bean Validation による構造検証と、プロバイダ資格情報・環境依存ルールの意味検証を行う
 * なぜ: 初期化の早い段階で致命的な設定ミスを止め、非致命的な懸念は警告として残すため
 */
package com.example.cloudsave.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CloudSaveConfigValidator {

  static final long MIN_RECOMMENDED_SAVE_SIZE = 1024;
  static final int MAX_RECOMMENDED_RETRY_ATTEMPTS = 10;

  private final Validator validator;

  public ConfigValidationResult validate(CloudSaveProperties config) {
    final Set<String> errors = new LinkedHashSet<>();
    final List<String> warnings = new ArrayList<>();

    for (ConstraintViolation<CloudSaveProperties> violation : validator.validate(config)) {
      errors.add(violation.getPropertyPath() + ": " + violation.getMessage());
    }

    final CloudSaveProperties.Provider provider = config.provider();
    if (provider.enabled()) {
      switch (provider.type()) {
        case FIREBASE -> validateFirebase(provider.firebase(), errors);
        case SUPABASE -> validateSupabase(provider.supabase(), errors);
        case NONE ->
            warnings.add("Cloud provider is enabled but no provider type is selected");
      }
    }

    if (config.settings().maxSaveSize() != null
        && config.settings().maxSaveSize() < MIN_RECOMMENDED_SAVE_SIZE) {
      warnings.add("Maximum save size is very small (< 1KB)");
    }
    if (config.settings().retryAttempts() != null
        && config.settings().retryAttempts() > MAX_RECOMMENDED_RETRY_ATTEMPTS) {
      warnings.add("High retry attempts may cause performance issues");
    }

    final CloudSaveProperties.Firebase firebase = provider.firebase();
    if (firebase.useEmulator() && provider.type() == ProviderType.FIREBASE) {
      if (config.isProduction()) {
        errors.add("Firebase emulator should not be used in production");
      }
      if (isBlank(firebase.emulatorHost())) {
        warnings.add("Firebase emulator is enabled but no emulator host is configured");
      }
    }
    if (config.isProduction() && config.debug()) {
      warnings.add("Debug mode should be disabled in production");
    }
    if (config.features().encryption()) {
      warnings.add("Encryption is not supported yet; save data is stored without encryption");
    }
    return new ConfigValidationResult(new ArrayList<>(errors), warnings);
  }

  private void validateFirebase(CloudSaveProperties.Firebase firebase, Set<String> errors) {
    requireText(firebase.apiKey(), "Firebase API key is required", errors);
    requireText(firebase.authDomain(), "Firebase auth domain is required", errors);
    requireText(firebase.projectId(), "Firebase project ID is required", errors);
    requireText(firebase.storageBucket(), "Firebase storage bucket is required", errors);
    requireText(
        firebase.messagingSenderId(), "Firebase messaging sender ID is required", errors);
    requireText(firebase.appId(), "Firebase app ID is required", errors);
  }

  private void validateSupabase(CloudSaveProperties.Supabase supabase, Set<String> errors) {
    requireText(supabase.url(), "Supabase URL is required", errors);
    requireText(supabase.anonKey(), "Supabase anonymous key is required", errors);
  }

  private static void requireText(String value, String message, Set<String> errors) {
    if (isBlank(value)) {
      errors.add(message);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
