package com.xksgroup.conversionengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceDescriptor {
    private String path;
    private long size;

    // Set when the caller named the file; only such sources are guarded against a second active conversion
    private boolean pathProvided;

    @JsonIgnore
    public boolean isValid() {
        return path != null && !path.isBlank() && size > 0;
    }
}
