package com.ivamare.eventstore.api.impl;

import com.ivamare.eventstore.exception.InvalidBucketNameException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives physical table names from logical bucket names.
 *
 * <p>Format: {@code components_<name>_events_<schema version>}. The schema
 * version is part of the name so a layout change starts a fresh table and
 * leaves the old one untouched.
 */
public final class BucketTableNames {

    public static final String SCHEMA_VERSION = "v0_4_0";

    static final String PREFIX = "components_";
    static final String SUFFIX = "_events_" + SCHEMA_VERSION;

    private static final Pattern SEPARATORS = Pattern.compile("[ \\-]");
    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[a-z0-9_]+");

    private BucketTableNames() {
    }

    /**
     * Normalize a logical name: spaces and hyphens become underscores, each
     * {@code __} pair becomes {@code _} in a single left-to-right pass, and the
     * result is lowercased. The single pass leaves longer runs partly intact
     * ({@code a___b} gives {@code a__b}) so existing tables keep their names.
     *
     * @param logicalName caller-supplied name
     * @return physical table name, not yet validated
     */
    public static String tableName(String logicalName) {
        String normalized = SEPARATORS.matcher(logicalName).replaceAll("_");
        normalized = normalized.replace("__", "_");
        normalized = normalized.toLowerCase(Locale.ROOT);
        return PREFIX + normalized + SUFFIX;
    }

    /**
     * Derive and validate the table name.
     *
     * @param logicalName caller-supplied name
     * @return physical table name safe to splice into SQL
     * @throws InvalidBucketNameException if the derived name is not a plain identifier
     */
    public static String safeTableName(String logicalName) {
        if (logicalName == null) {
            throw new InvalidBucketNameException(null, null);
        }
        String tableName = tableName(logicalName);
        if (!SAFE_TABLE_NAME.matcher(tableName).matches()) {
            throw new InvalidBucketNameException(logicalName, tableName);
        }
        return tableName;
    }
}
