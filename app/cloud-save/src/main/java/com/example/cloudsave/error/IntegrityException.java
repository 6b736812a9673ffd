/*
 * どこで: Cloud Save 整合性検証
 * 何を: チェックサムを計算できない状態を表す
 * なぜ: データ不整合 (結果として返す) と計算不能 (例外) を区別するため
 */
package com.example.cloudsave.error;

public class IntegrityException extends RuntimeException {

  public IntegrityException(String message, Throwable cause) {
    super(message, cause);
  }
}
