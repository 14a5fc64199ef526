package com.graysky.api.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Welcome book settings, bound from {@code app.visitors}.
 *
 * <pre>
 * app:
 *   visitors:
 *     storage: jpa
 *     data-file: data/welcome_book.json
 *     max-records: 1000
 *     rate-limit-window: 1h
 *     import-on-startup: false
 * </pre>
 */
@Data
public class VisitorProperties {

    /**
     * Which backend holds visitor and feedback records.
     */
    @NotNull
    private StorageType storage = StorageType.JPA;

    /**
     * JSON document used by the file backend, and the source for the startup import.
     */
    @NotBlank
    private String dataFile = "data/welcome_book.json";

    /**
     * Retention ceiling. Oldest visits are evicted once the count goes above it.
     */
    @Min(1)
    private int maxRecords = 1000;

    /**
     * Trailing window during which a name may not sign again.
     */
    @NotNull
    private Duration rateLimitWindow = Duration.ofHours(1);

    /**
     * Import {@link #dataFile} into the active store when the application starts.
     */
    private boolean importOnStartup = false;

    public enum StorageType {
        FILE,
        JPA
    }
}
