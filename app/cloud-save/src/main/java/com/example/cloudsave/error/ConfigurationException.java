/*
 * どこで: Cloud Save 初期化
 * 何を: 設定の読み込み・検証に失敗したことを表す
 * なぜ: 初期化を FAILED へ遷移させる致命的エラーを他の失敗と区別するため
 */
package com.example.cloudsave.error;

import java.util.List;

public class ConfigurationException extends RuntimeException {

  private final List<String> errors;

  public ConfigurationException(String message) {
    this(message, List.of(message), null);
  }

  public ConfigurationException(String message, Throwable cause) {
    this(message, List.of(message), cause);
  }

  public ConfigurationException(String message, List<String> errors, Throwable cause) {
    super(message, cause);
    this.errors = List.copyOf(errors);
  }

  public List<String> errors() {
    return errors;
  }
}
