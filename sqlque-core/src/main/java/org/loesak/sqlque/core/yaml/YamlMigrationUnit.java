package org.loesak.sqlque.core.yaml;

import lombok.Getter;
import lombok.NonNull;
import org.loesak.sqlque.core.jdbc.SchemaSession;
import org.loesak.sqlque.core.migration.AbstractMigrationUnit;
import org.loesak.sqlque.core.migration.Reversal;
import org.loesak.sqlque.core.yaml.model.MigrationFile;

import java.sql.SQLException;
import java.util.List;

/**
 * Migration defined by plain per-dialect SQL statements in a YAML resource. Statements are expected
 * to be re-runnable ({@code IF NOT EXISTS} and the like) since the whole list is executed again
 * after a failed attempt.
 */
public class YamlMigrationUnit extends AbstractMigrationUnit {

    @Getter
    private final String resource;

    @Getter
    private final Integer checksum;

    private final MigrationFile file;

    YamlMigrationUnit(
            @NonNull final String version,
            @NonNull final String displayName,
            @NonNull final String resource,
            @NonNull final Integer checksum,
            @NonNull final MigrationFile file) {
        super(version, displayName);
        this.resource = resource;
        this.checksum = checksum;
        this.file = file;
    }

    @Override
    protected void apply(final SchemaSession session) throws SQLException {
        final List<String> statements = this.file.getUp().forDialect(session.dialect());
        this.executeAll(session, statements);
    }

    @Override
    protected Reversal revert(final SchemaSession session) throws SQLException {
        final List<String> statements = this.file.getDown() == null ? null : this.file.getDown().forDialect(session.dialect());
        if (statements == null) {
            return Reversal.degraded(this.file.getDownLimitation() != null
                    ? this.file.getDownLimitation()
                    : String.format("[%s] defines no down statements for %s", this.resource, session.dialect().getDisplayName()));
        }

        this.executeAll(session, statements);
        return Reversal.complete();
    }

    private void executeAll(final SchemaSession session, final List<String> statements) throws SQLException {
        for (int position = 0; position < statements.size(); position++) {
            try {
                session.execute(statements.get(position));
            } catch (SQLException e) {
                throw new SQLException(
                        String.format("failed to execute statement in position [%d] defined in [%s]: %s", position, this.resource, e.getMessage()),
                        e.getSQLState(),
                        e);
            }
        }
    }
}
