package com.xksgroup.conversionengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Conversion settings handed to the worker. The engine only reads
 * {@code outputFormat} and {@code videoCodec} to size the space reservation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConversionParameters {
    private String outputFormat;
    private String videoCodec;
    private String audioCodec;
    private String quality;
    private String resolution;

    // Anything else the worker understands (preset, bitrate, custom ffmpeg flags...)
    private Map<String, String> extras;

    public ConversionParameters copy() {
        return toBuilder()
                .extras(extras != null ? new HashMap<>(extras) : null)
                .build();
    }
}
