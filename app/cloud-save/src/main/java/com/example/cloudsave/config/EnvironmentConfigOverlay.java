/*
 * どこで: Cloud Save 設定読み込み
 * 何を: CLOUD_SAVE_* 環境変数を設定ツリーの部分上書きへ変換する
 * なぜ: デプロイ環境ごとの資格情報や機能フラグを application.yml を編集せずに差し込むため
 */
package com.example.cloudsave.config;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EnvironmentConfigOverlay {

  private final Environment environment;

  public ObjectNode read() {
    final ObjectNode root = JsonNodeFactory.instance.objectNode();
    copy(root, "environment", "CLOUD_SAVE_ENVIRONMENT");
    copy(root, "debug", "CLOUD_SAVE_DEBUG");

    final ObjectNode firebase = JsonNodeFactory.instance.objectNode();
    copy(firebase, "apiKey", "CLOUD_SAVE_FIREBASE_API_KEY");
    copy(firebase, "authDomain", "CLOUD_SAVE_FIREBASE_AUTH_DOMAIN");
    copy(firebase, "projectId", "CLOUD_SAVE_FIREBASE_PROJECT_ID");
    copy(firebase, "storageBucket", "CLOUD_SAVE_FIREBASE_STORAGE_BUCKET");
    copy(firebase, "messagingSenderId", "CLOUD_SAVE_FIREBASE_MESSAGING_SENDER_ID");
    copy(firebase, "appId", "CLOUD_SAVE_FIREBASE_APP_ID");
    copy(firebase, "measurementId", "CLOUD_SAVE_FIREBASE_MEASUREMENT_ID");
    copy(firebase, "useEmulator", "CLOUD_SAVE_FIREBASE_USE_EMULATOR");
    copy(firebase, "emulatorHost", "CLOUD_SAVE_FIREBASE_EMULATOR_HOST");

    final ObjectNode supabase = JsonNodeFactory.instance.objectNode();
    copy(supabase, "url", "CLOUD_SAVE_SUPABASE_URL");
    copy(supabase, "anonKey", "CLOUD_SAVE_SUPABASE_ANON_KEY");
    copy(supabase, "serviceRoleKey", "CLOUD_SAVE_SUPABASE_SERVICE_ROLE_KEY");

    final ObjectNode provider = JsonNodeFactory.instance.objectNode();
    // Firebase の API キーを優先し、無ければ Supabase の URL と匿名キーの組で有効化する
    if (firebase.hasNonNull("apiKey")) {
      provider.put("type", ProviderType.FIREBASE.value());
      provider.put("enabled", true);
    } else if (supabase.hasNonNull("url") && supabase.hasNonNull("anonKey")) {
      provider.put("type", ProviderType.SUPABASE.value());
      provider.put("enabled", true);
    }
    if (!firebase.isEmpty()) {
      provider.set("firebase", firebase);
    }
    if (!supabase.isEmpty()) {
      provider.set("supabase", supabase);
    }
    if (!provider.isEmpty()) {
      root.set("provider", provider);
    }

    final ObjectNode features = JsonNodeFactory.instance.objectNode();
    copy(features, "compression", "CLOUD_SAVE_ENABLE_COMPRESSION");
    copy(features, "offlineQueue", "CLOUD_SAVE_ENABLE_OFFLINE_QUEUE");
    copy(features, "analytics", "CLOUD_SAVE_ENABLE_ANALYTICS");
    if (!features.isEmpty()) {
      root.set("features", features);
    }

    final ObjectNode settings = JsonNodeFactory.instance.objectNode();
    copy(settings, "retryAttempts", "CLOUD_SAVE_RETRY_ATTEMPTS");
    copy(settings, "maxSaveSize", "CLOUD_SAVE_MAX_SAVE_SIZE");
    if (!settings.isEmpty()) {
      root.set("settings", settings);
    }
    return root;
  }

  private void copy(ObjectNode target, String field, String variable) {
    final String value = environment.getProperty(variable);
    if (value == null || value.isBlank()) {
      return;
    }
    // 型変換は設定レコードへのバインド時に Jackson が行う
    target.put(field, value.trim());
  }
}
