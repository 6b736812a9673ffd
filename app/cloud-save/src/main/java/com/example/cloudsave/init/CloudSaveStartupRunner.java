package com.example.cloudsave.init;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Initializes the services at startup when {@code cloud-save.auto-initialize=true}. */
@Component
@ConditionalOnProperty(prefix = "cloud-save", name = "auto-initialize", havingValue = "true")
@RequiredArgsConstructor
public class CloudSaveStartupRunner implements ApplicationRunner {

  private final CloudSaveInitializer initializer;

  @Override
  public void run(ApplicationArguments args) {
    initializer.initialize(InitializationOptions.defaults()).join();
  }
}
