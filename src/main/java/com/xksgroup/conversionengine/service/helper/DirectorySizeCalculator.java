package com.xksgroup.conversionengine.service.helper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

@Component
@Slf4j
public class DirectorySizeCalculator {

    /**
     * Sum of all regular file sizes below {@code root}. A root that does not exist yet
     * counts as empty; an unreadable one is reported to the caller.
     */
    public long sizeOf(Path root) throws IOException {
        if (!Files.exists(root)) {
            return 0;
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .mapToLong(this::fileSize)
                    .sum();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private long fileSize(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            // A worker may delete temp files while we walk
            if (!Files.exists(path)) {
                log.debug("File vanished during size walk: {}", path);
                return 0;
            }
            throw new UncheckedIOException(e);
        }
    }
}
