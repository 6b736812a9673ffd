package com.example.cloudsave.init;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.config.ProviderType;
import com.example.cloudsave.metrics.CloudSaveMetrics;
import com.example.cloudsave.network.ConnectionInfo;
import com.example.cloudsave.network.PassiveConnectivitySource;
import com.example.cloudsave.storage.CloudStorageClient;
import com.example.cloudsave.storage.FirebaseStorageClient;
import com.example.cloudsave.storage.SupabaseStorageClient;
import com.example.cloudsave.support.GameStateFixtures;
import com.example.common.time.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestClient;

class CloudSaveServiceFactoryTest {

  private final TaskScheduler taskScheduler = mock(TaskScheduler.class);
  private final PassiveConnectivitySource passiveSource = mock(PassiveConnectivitySource.class);
  private final CloudSaveServiceFactory factory =
      new CloudSaveServiceFactory(
          RestClient.builder(),
          taskScheduler,
          mock(Sleeper.class),
          Clock.systemUTC(),
          GameStateFixtures.objectMapper(),
          new CloudSaveMetrics(new SimpleMeterRegistry()),
          passiveSource,
          List.of());

  @Test
  void featureFlagsDecideWhichServicesExist() {
    final CloudSaveProperties config =
        config(
            disabledProvider(),
            new CloudSaveProperties.Features(true, true, false, true, null, null));

    final CloudSaveServices services = factory.create(config);
    try {
      assertThat(services.compressor()).isPresent();
      assertThat(services.networkMonitor()).isEmpty();
      assertThat(services.storageClient()).isEmpty();
      assertThat(services.operationQueue()).isPresent();
      assertThat(services.operationQueue().get().getStatus().totalOperations()).isZero();
      assertThat(services.config()).isSameAs(config);
    } finally {
      services.shutdown();
    }
    verify(taskScheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
  }

  @Test
  void networkMonitoringStartsThePeriodicProbe() {
    when(passiveSource.isOnline()).thenReturn(true);
    when(passiveSource.connectionInfo()).thenReturn(ConnectionInfo.unknown());
    final CloudSaveProperties config =
        config(
            disabledProvider(),
            new CloudSaveProperties.Features(false, false, true, true, null, null));

    final CloudSaveServices services = factory.create(config);
    try {
      assertThat(services.compressor()).isEmpty();
      assertThat(services.operationQueue()).isEmpty();
      assertThat(services.networkMonitor()).isPresent();
      assertThat(services.networkMonitor().get().isOnline()).isTrue();
      verify(taskScheduler)
          .scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(Duration.ofSeconds(30)));
    } finally {
      services.shutdown();
    }
  }

  @Test
  void storageClientFollowsSelectedProvider() {
    final CloudStorageClient firebase =
        factory.createStorageClient(
            config(
                new CloudSaveProperties.Provider(
                    ProviderType.FIREBASE,
                    true,
                    new CloudSaveProperties.Firebase(
                        "key", null, "demo", null, null, null, null, null, null, null),
                    null),
                null),
            null);
    final CloudStorageClient supabase =
        factory.createStorageClient(
            config(
                new CloudSaveProperties.Provider(
                    ProviderType.SUPABASE,
                    true,
                    null,
                    new CloudSaveProperties.Supabase("https://project.supabase.test", "anon", null, null)),
                null),
            null);

    assertThat(firebase).isInstanceOf(FirebaseStorageClient.class);
    assertThat(supabase).isInstanceOf(SupabaseStorageClient.class);
    assertThat(factory.createStorageClient(config(disabledProvider(), null), null)).isNull();
  }

  @Test
  void enabledProviderWithoutCredentialsHasNoStorageClient() {
    final CloudSaveProperties config =
        config(new CloudSaveProperties.Provider(ProviderType.SUPABASE, true, null, null), null);

    assertThat(factory.createStorageClient(config, null)).isNull();
  }

  private static CloudSaveProperties.Provider disabledProvider() {
    return new CloudSaveProperties.Provider(ProviderType.FIREBASE, false, null, null);
  }

  private static CloudSaveProperties config(
      CloudSaveProperties.Provider provider, CloudSaveProperties.Features features) {
    return new CloudSaveProperties(
        "development",
        false,
        false,
        provider,
        features,
        null,
        new CloudSaveProperties.Queue(null, null, null, null, 1, null, false, null),
        null,
        null);
  }
}
