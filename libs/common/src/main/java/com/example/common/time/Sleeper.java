/*
 * どこで: Common 時刻ユーティリティ
 * 何を: 待機処理を関数として抽象化する
 * なぜ: リトライ間隔の待機をテストで即時化するため
 */
package com.example.common.time;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleeper() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      Thread.sleep(duration.toMillis());
    };
  }
}
