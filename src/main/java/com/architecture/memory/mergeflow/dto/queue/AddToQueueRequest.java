package com.architecture.memory.mergeflow.dto.queue;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddToQueueRequest {

    @NotNull(message = "prNumber is required")
    @Positive(message = "prNumber must be positive")
    private Integer prNumber;

    @Min(value = -100, message = "priority must be between -100 and 100")
    @Max(value = 100, message = "priority must be between -100 and 100")
    private int priority;
}
