/*
 * どこで: Cloud Save アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: オフラインキューの再試行とネットワーク監視のプローブを TaskScheduler で動かすため
 */
package com.example.cloudsave;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class CloudSaveApplication {

  public static void main(String[] args) {
    SpringApplication.run(CloudSaveApplication.class, args);
  }
}
