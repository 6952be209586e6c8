package com.pagewatch.service.config;

import com.pagewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String CONFIG_ENV = "PAGEWATCH_CONFIG";
    public static final String ADMIN_ENV = "ADMIN_USER_ID";
    static final Path DEFAULT_CONFIG = Path.of("config/pagewatch.json");

    private ConfigLoader() {
    }

    public static Path resolveConfigPath(Map<String, String> environment) {
        String configured = environment.get(CONFIG_ENV);
        return configured == null || configured.isBlank() ? DEFAULT_CONFIG : Path.of(configured);
    }

    public static PageWatchConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return JsonUtils.objectMapper().readValue(in, PageWatchConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + file, e);
        }
    }

    public static PageWatchConfig load(Path file, Map<String, String> environment) {
        return applyEnvironment(load(file), environment);
    }

    static PageWatchConfig applyEnvironment(PageWatchConfig config, Map<String, String> environment) {
        String admin = environment.get(ADMIN_ENV);
        if (admin == null || admin.isBlank()) {
            return config;
        }
        try {
            return config.withAdminUserId(Long.parseLong(admin.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalStateException(ADMIN_ENV + " must be a numeric user id but was '" + admin + "'", e);
        }
    }
}
