package com.gentoro.deepresearch.task;

/**
 * Partial update of a task. Null fields are left unchanged; a field cannot be cleared once set.
 */
public record TaskUpdate(
    TaskStatus status, String currentStep, Integer percent, String result, String error) {

  public TaskUpdate {
    if (percent != null && (percent < 0 || percent > 100)) {
      throw new IllegalArgumentException("percent must be within 0..100: " + percent);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shorthand for a stage transition. */
  public static TaskUpdate stage(TaskStatus status, String currentStep, int percent) {
    return new TaskUpdate(status, currentStep, percent, null, null);
  }

  public static TaskUpdate completed(String result) {
    return new TaskUpdate(TaskStatus.COMPLETED, "Completed", 100, result, null);
  }

  public static TaskUpdate failed(String error) {
    return new TaskUpdate(TaskStatus.FAILED, "Failed", null, null, error);
  }

  public static final class Builder {
    private TaskStatus status;
    private String currentStep;
    private Integer percent;
    private String result;
    private String error;

    private Builder() {}

    public Builder status(TaskStatus status) {
      this.status = status;
      return this;
    }

    public Builder currentStep(String currentStep) {
      this.currentStep = currentStep;
      return this;
    }

    public Builder percent(int percent) {
      this.percent = percent;
      return this;
    }

    public Builder result(String result) {
      this.result = result;
      return this;
    }

    public Builder error(String error) {
      this.error = error;
      return this;
    }

    public TaskUpdate build() {
      return new TaskUpdate(status, currentStep, percent, result, error);
    }
  }
}
