package com.myorg.esf.eventstore.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Instants go to {@code TIMESTAMP WITH TIME ZONE} columns as UTC offsets, independent of the JVM zone.
 */
final class UtcTimestamps {

    private UtcTimestamps() {
    }

    static OffsetDateTime bind(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant read(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
