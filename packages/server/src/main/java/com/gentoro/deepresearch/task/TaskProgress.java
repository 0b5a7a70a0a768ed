package com.gentoro.deepresearch.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Immutable snapshot of a task, as handed to pollers and subscribers. */
public record TaskProgress(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("status") TaskStatus status,
    @JsonProperty("current_step") String currentStep,
    @JsonProperty("percent") int percent,
    @JsonProperty("result") String result,
    @JsonProperty("error") String error,
    @JsonProperty("created_at") Instant createdAt) {

  static TaskProgress initial(String taskId, Instant createdAt) {
    return new TaskProgress(taskId, TaskStatus.PLANNING, "Starting...", 0, null, null, createdAt);
  }

  TaskProgress apply(TaskUpdate update) {
    return new TaskProgress(
        taskId,
        update.status() != null ? update.status() : status,
        update.currentStep() != null ? update.currentStep() : currentStep,
        update.percent() != null ? update.percent() : percent,
        update.result() != null ? update.result() : result,
        update.error() != null ? update.error() : error,
        createdAt);
  }
}
