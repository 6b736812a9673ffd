package com.example.cloudsave.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.cloudsave.error.CloudErrorCode;
import com.example.cloudsave.error.OperationException;
import com.example.cloudsave.queue.OperationMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class CustomOperationExecutorTest {

  private final CustomOperationExecutor executor =
      new CustomOperationExecutor(List.of(new EchoHandler("echo"), new NullHandler()));

  @Test
  void dispatchesArgsToNamedHandler() {
    final ObjectNode payload = JsonNodeFactory.instance.objectNode().put("handler", "echo");
    payload.putObject("args").put("value", 42);

    final JsonNode result = executor.execute(payload, OperationMetadata.forOwner("user-1"));

    assertThat(result.get("owner").textValue()).isEqualTo("user-1");
    assertThat(result.at("/args/value").intValue()).isEqualTo(42);
  }

  @Test
  void missingArgsAndNullResultsBecomeJsonNull() {
    final ObjectNode payload = JsonNodeFactory.instance.objectNode().put("handler", "echo");

    assertThat(executor.execute(payload, null).get("args").isNull()).isTrue();
    assertThat(
            executor
                .execute(JsonNodeFactory.instance.objectNode().put("handler", "nothing"), null)
                .isNull())
        .isTrue();
  }

  @Test
  void unknownHandlerFailsWithoutRetry() {
    assertThatThrownBy(
            () -> executor.execute(JsonNodeFactory.instance.objectNode().put("handler", "nope"), null))
        .isInstanceOfSatisfying(
            OperationException.class,
            ex -> {
              assertThat(ex.code()).isEqualTo(CloudErrorCode.OPERATION_FAILED);
              assertThat(ex.retryable()).isFalse();
            });
  }

  @Test
  void handlerNameIsRequired() {
    assertThatThrownBy(() -> executor.execute(JsonNodeFactory.instance.objectNode(), null))
        .isInstanceOfSatisfying(
            OperationException.class,
            ex -> assertThat(ex.code()).isEqualTo(CloudErrorCode.DATA_INVALID));
  }

  @Test
  void duplicateHandlerNamesAreRejected() {
    assertThatThrownBy(
            () -> new CustomOperationExecutor(List.of(new EchoHandler("a"), new EchoHandler("a"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("duplicate custom operation handler a");
  }

  private record EchoHandler(String name) implements CustomOperationHandler {

    @Override
    public JsonNode handle(JsonNode args, OperationMetadata metadata) {
      final ObjectNode result = JsonNodeFactory.instance.objectNode();
      result.put("owner", metadata == null ? null : metadata.ownerId());
      result.set("args", args);
      return result;
    }
  }

  private static final class NullHandler implements CustomOperationHandler {

    @Override
    public String name() {
      return "nothing";
    }

    @Override
    public JsonNode handle(JsonNode args, OperationMetadata metadata) {
      return null;
    }
  }
}
