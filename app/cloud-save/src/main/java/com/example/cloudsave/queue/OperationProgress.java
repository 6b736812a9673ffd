package com.example.cloudsave.queue;

public record OperationProgress(String operationId, int completedSteps, int totalSteps) {

  public int percent() {
    return totalSteps <= 0 ? 0 : completedSteps * 100 / totalSteps;
  }
}
