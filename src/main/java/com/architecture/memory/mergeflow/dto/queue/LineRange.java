package com.architecture.memory.mergeflow.dto.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive range of base-file lines touched by a diff hunk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineRange {
    private int start;
    private int end;

    public boolean overlaps(LineRange other, int buffer) {
        return start - buffer <= other.end && other.start - buffer <= end;
    }
}
