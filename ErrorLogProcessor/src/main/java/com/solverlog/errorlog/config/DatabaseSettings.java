package com.solverlog.errorlog.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PostgreSQL connection coordinates. Bound from application.yml, the settings
 * file and the configuration endpoint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseSettings {

    private static final String MASK = "********";

    @NotBlank
    @Builder.Default
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    @Builder.Default
    private int port = 5432;

    @NotBlank
    @Builder.Default
    private String user = "postgres";

    @Builder.Default
    private String password = "";

    @NotBlank
    @Builder.Default
    private String database = "solverlog";

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    /**
     * Copy safe to hand out over HTTP.
     */
    public DatabaseSettings masked() {
        return toBuilder().password(MASK).build();
    }
}
