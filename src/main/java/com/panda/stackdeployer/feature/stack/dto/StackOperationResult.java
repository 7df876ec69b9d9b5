package com.panda.stackdeployer.feature.stack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StackOperationResult {

    public static final String RUNNING = "RUNNING";
    public static final String SUCCEEDED = "SUCCEEDED";
    public static final String NO_OP = "NO_OP";
    public static final String FAILED = "FAILED";

    private String operationId;
    private String operation;           // DEPLOY or DESTROY
    private String deployName;
    private String status;              // RUNNING, SUCCEEDED, NO_OP, FAILED

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;

    private String stackArn;
    private Map<String, String> outputs;
    private String errorMessage;
    private String errorCode;

    private Integer eventCount;

    public boolean isSuccessful() {
        return SUCCEEDED.equals(status) || NO_OP.equals(status);
    }

    public boolean isFailed() {
        return FAILED.equals(status);
    }

    public boolean isCompleted() {
        return isSuccessful() || isFailed();
    }

    public String getFormattedDuration() {
        if (durationSeconds == null) {
            return "N/A";
        }
        long hours = durationSeconds / 3600;
        long minutes = (durationSeconds % 3600) / 60;
        long seconds = durationSeconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, seconds);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
