package com.example.cloudsave.api;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.cloudsave.config.CloudSaveProperties;
import com.example.cloudsave.config.ProviderType;
import com.example.cloudsave.init.CloudSaveInitializer;
import com.example.cloudsave.init.CloudSaveServices;
import com.example.cloudsave.init.ConfigurationSummary;
import com.example.cloudsave.init.InitializationPhase;
import com.example.cloudsave.init.InitializationStatus;
import com.example.cloudsave.integrity.IntegrityValidator;
import com.example.cloudsave.network.ConnectionInfo;
import com.example.cloudsave.network.ConnectionQuality;
import com.example.cloudsave.network.ConnectionType;
import com.example.cloudsave.network.EffectiveConnectionType;
import com.example.cloudsave.network.NetworkMonitor;
import com.example.cloudsave.network.NetworkStatistics;
import com.example.cloudsave.network.NetworkStatus;
import com.example.cloudsave.queue.OperationMetadata;
import com.example.cloudsave.queue.OperationQueue;
import com.example.cloudsave.queue.OperationType;
import com.example.cloudsave.queue.QueueStatus;
import com.example.cloudsave.queue.QueuedOperationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CloudSaveStatusController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class CloudSaveStatusControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CloudSaveInitializer initializer;

  @Test
  void statusReturnsSummaryAndNetworkView() throws Exception {
    final NetworkMonitor monitor = mock(NetworkMonitor.class);
    when(monitor.getStatus())
        .thenReturn(
            new NetworkStatus(
                true,
                new ConnectionInfo(
                    ConnectionType.WIFI, EffectiveConnectionType.UNKNOWN, 0, 0, false),
                NOW,
                null,
                true));
    when(monitor.getStatistics())
        .thenReturn(
            new NetworkStatistics(Duration.ofSeconds(90), Duration.ofSeconds(5), Duration.ofSeconds(95), 2));
    when(monitor.getConnectionQuality()).thenReturn(ConnectionQuality.UNKNOWN);
    when(monitor.isSuitableForCloudOperations()).thenReturn(false);
    when(initializer.getServices()).thenReturn(Optional.of(services(monitor, null)));
    when(initializer.isReady()).thenReturn(true);
    when(initializer.getConfigurationSummary())
        .thenReturn(
            new ConfigurationSummary(
                ProviderType.FIREBASE, "ready", List.of("offlineQueue", "networkMonitoring"), 0, 1));
    when(initializer.getStatus())
        .thenReturn(
            new InitializationStatus(
                true,
                true,
                true,
                ProviderType.FIREBASE,
                new InitializationStatus.EnabledFeatures(false, true, true),
                List.of(),
                List.of("High retry attempts may cause performance issues"),
                NOW,
                InitializationPhase.READY));

    mockMvc
        .perform(get("/v1/cloud-save/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ready").value(true))
        .andExpect(jsonPath("$.summary.provider").value("firebase"))
        .andExpect(jsonPath("$.summary.status").value("ready"))
        .andExpect(jsonPath("$.summary.warnings").value(1))
        .andExpect(jsonPath("$.initialization.is_initialized").value(true))
        .andExpect(jsonPath("$.initialization.phase").value("ready"))
        .andExpect(jsonPath("$.initialization.features.offline_queue").value(true))
        .andExpect(jsonPath("$.network.online").value(true))
        .andExpect(jsonPath("$.network.connection_type").value("wifi"))
        .andExpect(jsonPath("$.network.quality").value("unknown"))
        .andExpect(jsonPath("$.network.total_online_seconds").value(90))
        .andExpect(jsonPath("$.network.connection_switches").value(2));
  }

  @Test
  void statusBeforeInitializationHasNoNetworkView() throws Exception {
    when(initializer.getServices()).thenReturn(Optional.empty());
    when(initializer.isReady()).thenReturn(false);
    when(initializer.getConfigurationSummary())
        .thenReturn(new ConfigurationSummary(ProviderType.NONE, "not initialized", List.of(), 0, 0));
    when(initializer.getStatus()).thenReturn(InitializationStatus.idle(NOW));

    mockMvc
        .perform(get("/v1/cloud-save/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ready").value(false))
        .andExpect(jsonPath("$.summary.status").value("not initialized"))
        .andExpect(jsonPath("$.initialization.phase").value("idle"))
        .andExpect(jsonPath("$.network").doesNotExist());
  }

  @Test
  void queueFiltersByOwner() throws Exception {
    final OperationQueue queue = mock(OperationQueue.class);
    when(queue.getStatus()).thenReturn(new QueueStatus(2, 2, 0, 0, 0, false, null));
    when(queue.getOperationsByOwner("user-1"))
        .thenReturn(
            List.of(
                new QueuedOperationRecord(
                    "op_1",
                    OperationType.SAVE,
                    NOW,
                    0,
                    3,
                    5,
                    JsonNodeFactory.instance.objectNode().put("slot_number", 1),
                    OperationMetadata.forSlot("user-1", 1),
                    null,
                    null)));
    when(initializer.getServices()).thenReturn(Optional.of(services(null, queue)));

    mockMvc
        .perform(get("/v1/cloud-save/queue").param("owner_id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status.total_operations").value(2))
        .andExpect(jsonPath("$.status.is_processing").value(false))
        .andExpect(jsonPath("$.operations[0].id").value("op_1"))
        .andExpect(jsonPath("$.operations[0].type").value("save"))
        .andExpect(jsonPath("$.operations[0].metadata.owner_id").value("user-1"))
        .andExpect(jsonPath("$.operations[0].created_at").value("2026-01-17T00:00:00Z"));
  }

  @Test
  void queueWithoutRunningServicesReturns503() throws Exception {
    when(initializer.getServices()).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/cloud-save/queue"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("CLOUD_SAVE_NOT_READY"))
        .andExpect(jsonPath("$.message").value("offline queue is not running"));
  }

  private CloudSaveServices services(NetworkMonitor monitor, OperationQueue queue) {
    return new CloudSaveServices(
        CloudSaveProperties.defaults(),
        new IntegrityValidator(new ObjectMapper(), Clock.systemUTC()),
        null,
        monitor,
        queue,
        null,
        List.of());
  }
}
