package com.omniva.dbwatch.messaging.model;

import lombok.Getter;

import java.util.Comparator;
import java.util.Locale;

/**
 * Schema qualified database object name.
 * <p>
 * Blank schemas fall back to {@code dbo}. Equality is case-insensitive on the
 * bracketed full name, so instances are safe to use as map keys for the
 * monitored tables and for the generated triggers and ledger table.
 */
@Getter
public final class QualifiedTableName implements Comparable<QualifiedTableName> {

    public static final String DEFAULT_SCHEMA = "dbo";

    private static final Comparator<QualifiedTableName> ORDER = Comparator
            .comparing(QualifiedTableName::getSchema, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(t -> t.getName() == null ? "" : t.getName(), String.CASE_INSENSITIVE_ORDER);

    private final String schema;
    private final String name;

    public QualifiedTableName(String name) {
        this(name, null);
    }

    public QualifiedTableName(String name, String schema) {
        this.name = isBlank(name) ? null : name.trim();
        this.schema = isBlank(schema) ? DEFAULT_SCHEMA : schema.trim();
    }

    /**
     * Parse {@code name}, {@code schema.name} or {@code [schema].[name]}
     */
    public static QualifiedTableName parse(String qualifiedName) {
        if (isBlank(qualifiedName)) {
            return new QualifiedTableName(null);
        }
        String value = qualifiedName.trim();
        int separator = value.startsWith("[") ? value.indexOf("].") : value.indexOf('.');
        if (separator < 0) {
            return new QualifiedTableName(unquote(value));
        }
        int nameStart = value.startsWith("[") ? separator + 2 : separator + 1;
        String schemaPart = value.startsWith("[") ? value.substring(0, separator + 1) : value.substring(0, separator);
        return new QualifiedTableName(unquote(value.substring(nameStart)), unquote(schemaPart));
    }

    public boolean isValid() {
        return name != null;
    }

    /**
     * Bracketed form, e.g. {@code [dbo].[Orders]}; a {@code ]} inside either part is doubled
     */
    public String getFullName() {
        return String.format("[%s].[%s]", escapeIdentifier(schema), escapeIdentifier(name == null ? "" : name));
    }

    /**
     * Two part form without brackets, e.g. {@code dbo.Orders}
     */
    public String getAlternateFullName() {
        return String.format("%s.%s", schema, name == null ? "" : name);
    }

    @Override
    public int compareTo(QualifiedTableName other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QualifiedTableName other)) return false;
        return getFullName().equalsIgnoreCase(other.getFullName());
    }

    @Override
    public int hashCode() {
        return getFullName().toUpperCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return getFullName();
    }

    /**
     * Escapes one part of a name for use between brackets
     */
    public static String escapeIdentifier(String part) {
        return part.replace("]", "]]");
    }

    private static String unquote(String part) {
        String value = part.trim();
        if (value.startsWith("[") && value.endsWith("]") && value.length() >= 2) {
            value = value.substring(1, value.length() - 1).replace("]]", "]");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
