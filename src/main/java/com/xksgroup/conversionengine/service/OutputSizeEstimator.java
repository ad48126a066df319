package com.xksgroup.conversionengine.service;

import com.xksgroup.conversionengine.model.ConversionParameters;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Rough output size for a conversion, from codec compression ratio and container
 * overhead. Unknown names fall back to conservative defaults.
 */
@Component
public class OutputSizeEstimator {

    public static final double DEFAULT_COMPRESSION_RATIO = 0.8;
    public static final double DEFAULT_FORMAT_MULTIPLIER = 1.0;

    private static final Map<String, Double> CODEC_RATIOS = Map.ofEntries(
            Map.entry("h264", 0.7),
            Map.entry("h264_nvenc", 0.7),
            Map.entry("libx264", 0.7),
            Map.entry("h265", 0.5),
            Map.entry("hevc", 0.5),
            Map.entry("h265_nvenc", 0.5),
            Map.entry("libx265", 0.5),
            Map.entry("av1", 0.4),
            Map.entry("vp9", 0.6)
    );

    private static final Map<String, Double> FORMAT_MULTIPLIERS = Map.of(
            "mp4", 1.0,
            "mkv", 1.05,
            "avi", 1.1,
            "mov", 1.02,
            "webm", 0.9
    );

    public long estimate(long sourceBytes, ConversionParameters parameters) {
        if (parameters == null) {
            return estimate(sourceBytes, null, null);
        }
        return estimate(sourceBytes, parameters.getOutputFormat(), parameters.getVideoCodec());
    }

    public long estimate(long sourceBytes, String outputFormat, String videoCodec) {
        return Math.round(sourceBytes * compressionRatio(videoCodec) * formatMultiplier(outputFormat));
    }

    public double compressionRatio(String videoCodec) {
        return CODEC_RATIOS.getOrDefault(normalize(videoCodec), DEFAULT_COMPRESSION_RATIO);
    }

    public double formatMultiplier(String outputFormat) {
        return FORMAT_MULTIPLIERS.getOrDefault(normalize(outputFormat), DEFAULT_FORMAT_MULTIPLIER);
    }

    static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith(".") ? normalized.substring(1) : normalized;
    }
}
