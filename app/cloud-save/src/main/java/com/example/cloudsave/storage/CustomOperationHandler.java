package com.example.cloudsave.storage;

import com.example.cloudsave.queue.OperationMetadata;
import com.fasterxml.jackson.databind.JsonNode;

/** Named handler for {@code custom} operations, registered as a Spring bean. */
public interface CustomOperationHandler {

  String name();

  JsonNode handle(JsonNode args, OperationMetadata metadata);
}
