package com.jobbus.postgres;

import com.jobbus.config.JobBusProperties;

import java.util.regex.Pattern;

/**
 * Physical table names after applying {@code jobbus.database.table-prefix}.
 */
public record BusTables(String topics, String subscriptions, String messages) {

    public static final String TABLE_NAME_PREFIX = "jobbus_";
    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static BusTables from(JobBusProperties properties) {
        String prefix = properties.getDatabase().getTablePrefix();
        String normalized = prefix == null ? "" : prefix.trim();
        return new BusTables(
                resolve(normalized, "jobbus_topics"),
                resolve(normalized, "jobbus_subscriptions"),
                resolve(normalized, "jobbus_messages"));
    }

    private static String resolve(String prefix, String table) {
        String resolved = prefix + table;
        if (!SAFE_TABLE_NAME.matcher(resolved).matches()) {
            throw new IllegalArgumentException("Invalid JobBus table prefix: " + prefix);
        }
        return resolved;
    }
}
