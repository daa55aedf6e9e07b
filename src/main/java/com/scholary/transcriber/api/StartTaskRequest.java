package com.scholary.transcriber.api;

import com.scholary.transcriber.job.TaskOptions;
import com.scholary.transcriber.job.TaskPriority;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Request to transcribe an uploaded file in the background.
 *
 * <p>Every field is optional; the configured defaults apply to what is left out.
 */
public record StartTaskRequest(
    @Size(min = 2, max = 8) String language,
    String model,
    @DecimalMin("0.0") @DecimalMax("1.0") Double temperature,
    @Size(max = 1000) String prompt,
    TaskPriority priority,
    @Positive Double chunkSeconds,
    @PositiveOrZero Double overlapSeconds) {

  TaskOptions toOptions() {
    return new TaskOptions(
        language,
        model,
        temperature != null ? temperature : 0.0,
        prompt,
        priority,
        chunkSeconds,
        overlapSeconds);
  }
}
