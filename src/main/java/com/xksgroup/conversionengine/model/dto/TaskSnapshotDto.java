package com.xksgroup.conversionengine.model.dto;

import com.xksgroup.conversionengine.model.ConversionParameters;
import com.xksgroup.conversionengine.model.Task;
import com.xksgroup.conversionengine.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSnapshotDto {

    private String taskId;
    private String name;
    private String ownerId;
    private TaskStatus status;
    private String statusMessage;

    // Progress tracking
    private int progress;
    private Double speed;
    private Integer etaSeconds;
    private String remainingTime;

    // Source file
    private String sourcePath;
    private long sourceSize;
    private String sourceSizeFormatted;
    private ConversionParameters parameters;

    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int retryCount;
    private int maxRetries;

    private long revision;

    public static TaskSnapshotDto fromTask(Task task) {
        long size = task.getSource() != null ? task.getSource().getSize() : 0;
        return TaskSnapshotDto.builder()
                .taskId(task.getId())
                .name(task.getName())
                .ownerId(task.getOwnerId())
                .status(task.getStatus())
                .statusMessage(generateStatusMessage(task))

                .progress(task.getProgress())
                .speed(task.getSpeed())
                .etaSeconds(task.getEtaSeconds())
                .remainingTime(formatDuration(task.getEtaSeconds()))

                .sourcePath(task.getSource() != null ? task.getSource().getPath() : null)
                .sourceSize(size)
                .sourceSizeFormatted(formatFileSize(size))
                .parameters(task.getParameters() != null ? task.getParameters().copy() : null)

                .errorMessage(task.getErrorMessage())

                .createdAt(task.getCreatedAt())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())

                .retryCount(task.getRetryCount())
                .maxRetries(task.getMaxRetries())
                .revision(task.getRevision())
                .build();
    }

    public static String formatFileSize(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }

        String[] units = {"B", "KB", "MB", "GB", "TB"};
        int unitIndex = 0;
        double size = bytes;

        while (size >= 1024.0 && unitIndex < units.length - 1) {
            size /= 1024.0;
            unitIndex++;
        }

        return String.format("%.1f %s", size, units[unitIndex]);
    }

    public static String formatDuration(Integer seconds) {
        if (seconds == null || seconds < 0) {
            return null;
        }
        long minutes = seconds / 60;
        long remaining = seconds % 60;
        if (minutes >= 60) {
            return String.format("%dh %dm %ds", minutes / 60, minutes % 60, remaining);
        }
        return minutes > 0 ? String.format("%dm %ds", minutes, remaining) : remaining + "s";
    }

    private static String generateStatusMessage(Task task) {
        if (task.getStatus() == null) {
            return null;
        }
        return switch (task.getStatus()) {
            case PENDING -> "Waiting for a worker...";
            case CONVERTING -> String.format("Converting... %d%%", task.getProgress());
            case COMPLETED -> "Conversion completed successfully!";
            case FAILED -> "Conversion failed: " + (task.getErrorMessage() != null ? task.getErrorMessage() : "Unknown error");
            case CANCELLED -> "Conversion was cancelled";
        };
    }
}
