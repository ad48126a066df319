package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.exception.ValidationException;
import com.xksgroup.conversionengine.model.SpaceBudget;
import com.xksgroup.conversionengine.model.SpaceCheckResult;
import com.xksgroup.conversionengine.model.SpaceUsageSnapshot;
import com.xksgroup.conversionengine.model.dto.SpaceCheckRequest;
import com.xksgroup.conversionengine.model.dto.SpaceEstimateResponse;
import com.xksgroup.conversionengine.repo.SettingsStore;
import com.xksgroup.conversionengine.service.helper.BackgroundSupervisor;
import com.xksgroup.conversionengine.service.helper.DirectorySizeCalculator;
import com.xksgroup.conversionengine.service.helper.TimeSource;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicReference;

import static com.xksgroup.conversionengine.model.dto.TaskSnapshotDto.formatFileSize;

/**
 * Tracks how much of the configured storage budget is in use. The usage snapshot is
 * recomputed by walking the storage roots and swapped in atomically; checks read the
 * latest snapshot and subtract what the ledger has already promised.
 */
@Slf4j
@Service
public class SpaceAccountant {

    public static final String KEY_MAX_TOTAL = "space.maxTotal";
    public static final String KEY_RESERVED = "space.reserved";
    public static final String KEY_ENABLED = "space.enabled";
    public static final String KEY_UPDATED_AT = "space.updatedAt";
    public static final String KEY_UPDATED_BY = "space.updatedBy";

    static final double DEFAULT_OUTPUT_RATIO = 0.7;
    static final double WARNING_PERCENTAGE = 80.0;
    static final double CRITICAL_PERCENTAGE = 90.0;

    private final SettingsStore settingsStore;
    private final DirectorySizeCalculator sizeCalculator;
    private final SpaceLedger ledger;
    private final OutputSizeEstimator estimator;
    private final EngineEventPublisher eventPublisher;
    private final BackgroundSupervisor supervisor;
    private final TimeSource timeSource;

    private final Path sourceDir;
    private final Path outputDir;
    private final Path tempDir;
    private final long monitorIntervalMs;
    private final long monitorInitialDelayMs;

    private final AtomicReference<SpaceUsageSnapshot> snapshot = new AtomicReference<>();
    private volatile SpaceBudget budget = SpaceBudget.defaults();

    public SpaceAccountant(SettingsStore settingsStore,
                           DirectorySizeCalculator sizeCalculator,
                           SpaceLedger ledger,
                           OutputSizeEstimator estimator,
                           EngineEventPublisher eventPublisher,
                           BackgroundSupervisor supervisor,
                           TimeSource timeSource,
                           @Value("${conversion.storage.source-dir:data/uploads}") String sourceDir,
                           @Value("${conversion.storage.output-dir:data/outputs}") String outputDir,
                           @Value("${conversion.storage.temp-dir:data/temp}") String tempDir,
                           @Value("${conversion.space.monitor-interval-ms:30000}") long monitorIntervalMs,
                           @Value("${conversion.space.monitor-initial-delay-ms:10000}") long monitorInitialDelayMs) {
        this.settingsStore = settingsStore;
        this.sizeCalculator = sizeCalculator;
        this.ledger = ledger;
        this.estimator = estimator;
        this.eventPublisher = eventPublisher;
        this.supervisor = supervisor;
        this.timeSource = timeSource;
        this.sourceDir = Paths.get(sourceDir);
        this.outputDir = Paths.get(outputDir);
        this.tempDir = Paths.get(tempDir);
        this.monitorIntervalMs = monitorIntervalMs;
        this.monitorInitialDelayMs = monitorInitialDelayMs;
    }

    @PostConstruct
    public void init() {
        budget = loadBudget();
        log.info("Space budget loaded - Total: {}, Reserved: {}, Enabled: {}",
                formatFileSize(budget.getMaxTotalBytes()), formatFileSize(budget.getReservedBytes()), budget.isEnabled());
        refresh();
        if (monitorIntervalMs > 0) {
            supervisor.scheduleWithFixedDelay("space-monitor", this::monitor, monitorInitialDelayMs, monitorIntervalMs);
        }
    }

    /**
     * Recomputes usage from disk. If a root cannot be walked the previous snapshot is
     * kept and flagged stale; with no previous snapshot usage is reported as unknown.
     */
    public SpaceUsageSnapshot refresh() {
        SpaceBudget current = budget;
        LocalDateTime now = timeSource.now();
        try {
            long sourceBytes = sizeCalculator.sizeOf(sourceDir);
            long outputBytes = sizeCalculator.sizeOf(outputDir);
            long tempBytes = sizeCalculator.sizeOf(tempDir);
            SpaceUsageSnapshot fresh = SpaceUsageSnapshot.of(current, sourceBytes, outputBytes, tempBytes, now);
            snapshot.set(fresh);
            log.debug("Space usage recomputed - Used: {} ({}%), Available: {}",
                    formatFileSize(fresh.getUsedBytes()), String.format("%.1f", fresh.getUsagePercentage()),
                    formatFileSize(fresh.getAvailableBytes()));
            return fresh;
        } catch (IOException e) {
            log.warn("Failed to compute storage usage, keeping previous snapshot: {}", e.getMessage());
            return snapshot.updateAndGet(previous -> previous != null
                    ? previous.toBuilder().stale(true).build()
                    : SpaceUsageSnapshot.unknown(current, now));
        }
    }

    /**
     * Latest snapshot with the ledger's pending reservations folded in.
     */
    public SpaceUsageSnapshot getUsage() {
        SpaceUsageSnapshot current = snapshot.get();
        if (current == null) {
            current = refresh();
        }
        long pending = ledger.pendingBytes();
        return current.toBuilder()
                .pendingReservationBytes(pending)
                .availableBytes(Math.max(0, current.getAvailableBytes() - pending))
                .build();
    }

    public SpaceCheckResult checkSpace(long requiredBytes) {
        if (requiredBytes < 0) {
            throw new ValidationException("Required space must not be negative");
        }
        return checkSpace(SpaceCheckRequest.ofRequiredBytes(requiredBytes));
    }

    /**
     * Original plus output plus, optionally, a tenth of the original for temporary files.
     *
     * @throws ValidationException when the total does not fit in a long
     */
    public static long requiredBytes(long original, long output, boolean includeTemp) {
        try {
            return Math.addExact(Math.addExact(original, output), includeTemp ? original / 10 : 0);
        } catch (ArithmeticException e) {
            throw new ValidationException(String.format(
                    "Requested size is too large (original %d bytes, output %d bytes)", original, output));
        }
    }

    public SpaceCheckResult checkSpace(SpaceCheckRequest request) {
        long original = request.getOriginalFileSize();
        if (original < 0) {
            throw new ValidationException("originalFileSize must not be negative");
        }
        if (request.getEstimatedOutputSize() != null && request.getEstimatedOutputSize() < 0) {
            throw new ValidationException("estimatedOutputSize must not be negative");
        }
        long output = request.getEstimatedOutputSize() != null
                ? request.getEstimatedOutputSize()
                : Math.round(original * DEFAULT_OUTPUT_RATIO);
        long temp = request.isIncludeTempSpace() ? original / 10 : 0;
        long required = requiredBytes(original, output, request.isIncludeTempSpace());

        SpaceBudget current = budget;
        SpaceUsageSnapshot usage = snapshot.get();
        boolean usageKnown = usage != null && usage.isUsageKnown();
        long used = usageKnown ? usage.getUsedBytes() : 0;
        long pending = ledger.pendingBytes();

        SpaceCheckResult.Details details = SpaceCheckResult.Details.builder()
                .originalFileSpace(original)
                .outputFileSpace(output)
                .tempFileSpace(temp)
                .reservedSpace(current.getReservedBytes())
                .pendingReservedSpace(pending)
                .currentUsedSpace(used)
                .totalConfiguredSpace(current.getMaxTotalBytes())
                .build();

        if (!current.isEnabled()) {
            return SpaceCheckResult.builder()
                    .hasEnoughSpace(true)
                    .requiredSpace(required)
                    .availableSpace(Long.MAX_VALUE)
                    .message("Space limiting is disabled")
                    .details(details)
                    .build();
        }

        if (!usageKnown) {
            log.warn("Refusing space check for {}: storage usage has not been measured yet", formatFileSize(required));
            return SpaceCheckResult.builder()
                    .hasEnoughSpace(false)
                    .requiredSpace(required)
                    .availableSpace(0)
                    .message("Storage usage unknown: no directory scan has succeeded yet")
                    .details(details)
                    .build();
        }

        long available = Math.max(0, current.getMaxTotalBytes() - current.getReservedBytes() - used - pending);
        boolean enough = required <= available;
        String message = enough
                ? "Sufficient space"
                : String.format("Insufficient space: %s required, %s available",
                        formatFileSize(required), formatFileSize(available));

        return SpaceCheckResult.builder()
                .hasEnoughSpace(enough)
                .requiredSpace(required)
                .availableSpace(available)
                .message(message)
                .details(details)
                .build();
    }

    public SpaceEstimateResponse estimate(long originalFileSize, String outputFormat, String videoCodec) {
        if (originalFileSize <= 0) {
            throw new ValidationException("originalFileSize must be positive");
        }
        double ratio = estimator.compressionRatio(videoCodec) * estimator.formatMultiplier(outputFormat);
        long estimatedOutput = estimator.estimate(originalFileSize, outputFormat, videoCodec);
        SpaceCheckResult check = checkSpace(SpaceCheckRequest.builder()
                .originalFileSize(originalFileSize)
                .estimatedOutputSize(estimatedOutput)
                .includeTempSpace(true)
                .build());

        return new SpaceEstimateResponse(
                originalFileSize,
                estimatedOutput,
                check.getRequiredSpace(),
                ratio,
                check.isHasEnoughSpace(),
                check.getMessage());
    }

    public SpaceBudget getBudget() {
        return budget.toBuilder().build();
    }

    public SpaceBudget updateBudget(long maxTotalBytes, long reservedBytes, boolean enabled, String updatedBy) {
        if (maxTotalBytes <= 0) {
            throw new ValidationException("maxTotal must be positive");
        }
        if (reservedBytes < 0) {
            throw new ValidationException("reserved must not be negative");
        }
        if (reservedBytes >= maxTotalBytes) {
            log.warn("Rejected space configuration - MaxTotal: {}, Reserved: {}", maxTotalBytes, reservedBytes);
            throw new ValidationException("reserved must be smaller than maxTotal");
        }

        SpaceBudget updated = SpaceBudget.builder()
                .maxTotalBytes(maxTotalBytes)
                .reservedBytes(reservedBytes)
                .enabled(enabled)
                .updatedAt(timeSource.now())
                .updatedBy(updatedBy != null && !updatedBy.isBlank() ? updatedBy : "System")
                .build();

        settingsStore.put(KEY_MAX_TOTAL, Long.toString(updated.getMaxTotalBytes()));
        settingsStore.put(KEY_RESERVED, Long.toString(updated.getReservedBytes()));
        settingsStore.put(KEY_ENABLED, Boolean.toString(updated.isEnabled()));
        settingsStore.put(KEY_UPDATED_AT, updated.getUpdatedAt().toString());
        settingsStore.put(KEY_UPDATED_BY, updated.getUpdatedBy());
        budget = updated;

        log.info("Space budget updated by {} - Total: {}, Reserved: {}, Enabled: {}",
                updated.getUpdatedBy(), formatFileSize(maxTotalBytes), formatFileSize(reservedBytes), enabled);

        eventPublisher.publishSpaceStatus(refresh(), true);
        return updated.toBuilder().build();
    }

    void monitor() {
        SpaceUsageSnapshot current = refresh();
        if (current.isEnabled()) {
            if (current.getUsagePercentage() > CRITICAL_PERCENTAGE) {
                log.warn("Storage critically low: {}% of budget used", String.format("%.1f", current.getUsagePercentage()));
            } else if (current.getUsagePercentage() > WARNING_PERCENTAGE) {
                log.warn("Storage running low: {}% of budget used", String.format("%.1f", current.getUsagePercentage()));
            }
        }
        eventPublisher.publishSpaceStatus(current, false);
    }

    private SpaceBudget loadBudget() {
        SpaceBudget defaults = SpaceBudget.defaults();
        long maxTotal = settingsStore.getLong(KEY_MAX_TOTAL, defaults.getMaxTotalBytes());
        long reserved = settingsStore.getLong(KEY_RESERVED, defaults.getReservedBytes());
        if (maxTotal <= 0 || reserved < 0 || reserved >= maxTotal) {
            log.warn("Stored space configuration is invalid (MaxTotal: {}, Reserved: {}), using defaults", maxTotal, reserved);
            return defaults;
        }

        LocalDateTime updatedAt = settingsStore.get(KEY_UPDATED_AT)
                .map(value -> {
                    try {
                        return LocalDateTime.parse(value);
                    } catch (DateTimeParseException e) {
                        log.warn("Ignoring malformed {}: '{}'", KEY_UPDATED_AT, value);
                        return null;
                    }
                })
                .orElse(null);

        return SpaceBudget.builder()
                .maxTotalBytes(maxTotal)
                .reservedBytes(reserved)
                .enabled(settingsStore.getBoolean(KEY_ENABLED, defaults.isEnabled()))
                .updatedAt(updatedAt)
                .updatedBy(settingsStore.getString(KEY_UPDATED_BY, defaults.getUpdatedBy()))
                .build();
    }
}
