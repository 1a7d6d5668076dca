package com.architecture.memory.mergeflow.dto.queue;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueOperationResult {

    private boolean success;
    private String message;

    public static QueueOperationResult ok(String message) {
        return new QueueOperationResult(true, message);
    }

    public static QueueOperationResult failed(String message) {
        return new QueueOperationResult(false, message);
    }
}
