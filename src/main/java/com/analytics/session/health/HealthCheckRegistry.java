package com.analytics.session.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status.
 * The aggregate takes the worst individual status; a check that throws counts as DOWN.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> perCheck = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        String worstName = null;

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            perCheck.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", String.valueOf(result.message()),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, perCheck);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check threw: " + e.getMessage());
        }
    }
}
