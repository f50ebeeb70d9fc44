package org.loesak.sqlque.core.yaml.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.loesak.sqlque.core.jdbc.Dialect;

import java.util.List;

/**
 * Contents of a {@code V<version>__<Description>.yml} migration resource.
 *
 * <pre>
 * name: Create notifications table
 * up:
 *   postgresql:
 *     - CREATE TABLE IF NOT EXISTS ...
 *   sqlite:
 *     - CREATE TABLE IF NOT EXISTS ...
 * down:
 *   postgresql:
 *     - DROP TABLE IF EXISTS ...
 * downLimitation: the notifications table is kept on SQLite
 * </pre>
 */
@Data
@NoArgsConstructor
public class MigrationFile {

    /** display name. defaults to the description part of the file name */
    private String name;

    private DialectStatements up;

    private DialectStatements down;

    /** reported when {@code down} has no statements for the active dialect */
    private String downLimitation;

    @Data
    @NoArgsConstructor
    public static class DialectStatements {

        private List<String> postgresql;

        private List<String> sqlite;

        /**
         * Statements for the dialect, or {@code null} when the file defines none.
         */
        public List<String> forDialect(final Dialect dialect) {
            return dialect == Dialect.POSTGRESQL ? this.postgresql : this.sqlite;
        }
    }
}
