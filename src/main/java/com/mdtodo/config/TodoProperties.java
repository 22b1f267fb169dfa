package com.mdtodo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code todo.*} settings.
 *
 * <ul>
 *   <li>{@code todo.storage.type}: {@code memory} (default) or {@code jdbc}
 *   <li>{@code todo.cors.allowed-origins}: origin patterns for the browser client, {@code *} by default
 *   <li>{@code todo.sample-data.enabled}: seed an empty store with sample todos at startup
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "todo")
public class TodoProperties {

    @Valid @NotNull private Storage storage = new Storage();

    @Valid @NotNull private Cors cors = new Cors();

    @Valid @NotNull private SampleData sampleData = new SampleData();

    public enum StorageType {
        MEMORY,
        JDBC
    }

    @Getter
    @Setter
    public static class Storage {
        @NotNull private StorageType type = StorageType.MEMORY;
    }

    @Getter
    @Setter
    public static class Cors {
        @NotEmpty private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Getter
    @Setter
    public static class SampleData {
        private boolean enabled = false;
    }
}
