package org.loesak.sqlque.core.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.Sqlque;
import org.loesak.sqlque.core.SqlqueConfiguration;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.exception.SqlqueException;
import org.loesak.sqlque.core.migration.MigrationRegistry;
import org.loesak.sqlque.core.result.MigrationResult;
import org.loesak.sqlque.core.result.MigrationState;
import org.loesak.sqlque.core.result.MigrationStatusReport;
import org.loesak.sqlque.core.result.RollbackResult;

import java.io.PrintStream;
import java.util.Map;

/**
 * Command line surface over {@link Sqlque}:
 *
 * <pre>
 * [migrate]                 apply pending migrations (default)
 * status [--json]           list applied and pending migrations
 * rollback                  revert the most recently applied migration
 * repair &lt;version&gt;          clear a failed ledger entry so it is retried
 * --database-url &lt;url&gt;     overrides DATABASE_URL
 * </pre>
 *
 * Exit codes: 0 success, 1 failed or incomplete, 2 usage or configuration error.
 */
@Slf4j
public class SqlqueCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final MigrationRegistry registry;
    private final Map<String, String> environment;
    private final PrintStream out;
    private final PrintStream err;

    private final ObjectMapper objectMapper;

    public SqlqueCommand(
            @NonNull final MigrationRegistry registry,
            @NonNull final Map<String, String> environment,
            @NonNull final PrintStream out,
            @NonNull final PrintStream err) {
        this.registry = registry;
        this.environment = environment;
        this.out = out;
        this.err = err;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.registerModule(new Jdk8Module());
        this.objectMapper.registerModule(new ParameterNamesModule());
        this.objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public int run(final String... args) {
        final CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException e) {
            this.err.println("Error: " + e.getMessage());
            this.err.println();
            this.printHelp(this.err);
            return EXIT_USAGE;
        }

        if (parsed.help) {
            this.printHelp(this.out);
            return EXIT_OK;
        }

        SqlqueConfiguration configuration;
        try {
            configuration = SqlqueConfiguration.fromEnvironment(this.environment);
            if (parsed.databaseUrl != null) {
                configuration = configuration.withDatabaseUrl(parsed.databaseUrl);
            }
        } catch (SqlqueException e) {
            this.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        final Sqlque sqlque;
        try {
            sqlque = new Sqlque(configuration, this.registry, new ConsoleMigrationListener(this.out));
        } catch (SqlqueException e) {
            this.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        this.out.printf("Connected to %s%n", sqlque.getDialectAdapter().getDialect().getDisplayName());

        try {
            switch (parsed.mode) {
                case STATUS:
                    return this.status(sqlque, parsed.json);
                case ROLLBACK:
                    return this.rollback(sqlque);
                case REPAIR:
                    return this.repair(sqlque, parsed.version);
                case MIGRATE:
                default:
                    return this.migrate(sqlque);
            }
        } catch (SqlqueException e) {
            log.error("sqlque command [{}] failed", parsed.mode, e);
            this.err.println("Error: " + e.getMessage());
            return e instanceof MigrationConfigurationException ? EXIT_USAGE : EXIT_FAILURE;
        }
    }

    private int migrate(final Sqlque sqlque) {
        final MigrationResult result = sqlque.migrate();
        return result.isSuccessful() ? EXIT_OK : EXIT_FAILURE;
    }

    private int status(final Sqlque sqlque, final boolean json) {
        final MigrationStatusReport report = sqlque.status();

        if (json) {
            try {
                this.out.println(this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("failed to serialize migration status", e);
            }
            return EXIT_OK;
        }

        this.out.printf("Applied: %d%n", report.getAppliedVersions().size());
        for (MigrationState migration : report.getMigrations()) {
            if (migration.getState() == MigrationState.State.APPLIED) {
                this.out.printf("  [x] %s  %s  (%s, %d ms)%n",
                        migration.getVersion(), migration.getName(), migration.getAppliedAt(), migration.getExecutionTimeMs());
            }
        }

        this.out.printf("Pending: %d%n", report.getPendingVersions().size());
        for (MigrationState migration : report.getMigrations()) {
            if (migration.getState() == MigrationState.State.PENDING) {
                this.out.printf("  [ ] %s  %s%n", migration.getVersion(), migration.getName());
            } else if (migration.getState() == MigrationState.State.FAILED) {
                this.out.printf("  [!] %s  %s  (failed %d time(s): %s)%n",
                        migration.getVersion(), migration.getName(), migration.getAttempts(), migration.getErrorMessage());
            }
        }

        if (!report.getUnknownVersions().isEmpty()) {
            this.out.printf("Unknown to this build: %s%n", report.getUnknownVersions());
        }

        return EXIT_OK;
    }

    private int rollback(final Sqlque sqlque) {
        final RollbackResult result = sqlque.rollback();

        switch (result.getOutcome()) {
            case NOTHING_TO_ROLL_BACK:
                this.out.println("No applied migrations to roll back");
                return EXIT_OK;
            case ROLLED_BACK:
                this.out.printf("Rolled back %s%n", result.getVersion());
                return EXIT_OK;
            case ROLLED_BACK_DEGRADED:
                this.out.printf("Rolled back %s%n", result.getVersion());
                this.out.printf("WARNING: the reversal was incomplete on %s: %s%n",
                        sqlque.getDialectAdapter().getDialect().getDisplayName(), result.getMessage());
                return EXIT_OK;
            case FAILED:
            default:
                this.err.printf("Rollback of %s failed: %s%n", result.getVersion(), result.getMessage());
                return EXIT_FAILURE;
        }
    }

    private int repair(final Sqlque sqlque, final String version) {
        if (sqlque.repair(version)) {
            this.out.printf("Cleared failed ledger entry for %s. It will be attempted on the next run%n", version);
        } else {
            this.out.printf("No failed ledger entry found for %s%n", version);
        }
        return EXIT_OK;
    }

    private void printHelp(final PrintStream stream) {
        stream.println("Usage: sqlque [migrate | status [--json] | rollback | repair <version>] [--database-url <url>]");
        stream.println();
        stream.println("Commands:");
        stream.println("  migrate             apply pending migrations in version order (default)");
        stream.println("  status              show applied and pending migrations");
        stream.println("  rollback            revert the most recently applied migration");
        stream.println("  repair <version>    clear a failed migration so it is attempted again");
        stream.println();
        stream.println("Options:");
        stream.println("  --database-url <url>  postgresql://... or sqlite:///path.db (defaults to DATABASE_URL)");
        stream.println("  --json                print status as JSON");
        stream.println("  -h, --help            show this help");
    }

    enum Mode {
        MIGRATE,
        STATUS,
        ROLLBACK,
        REPAIR
    }

    static final class CliArgs {
        boolean help = false;
        boolean json = false;
        Mode mode = null;
        String version;
        String databaseUrl;

        static CliArgs parse(final String[] args) {
            final CliArgs parsed = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                final String arg = args[i];
                if (arg == null) continue;

                if (arg.startsWith("--database-url=")) {
                    parsed.databaseUrl = arg.substring("--database-url=".length());
                    continue;
                }

                switch (arg) {
                    case "--help":
                    case "-h":
                        parsed.help = true;
                        break;
                    case "--database-url":
                        parsed.databaseUrl = requireValue(args, ++i, "--database-url");
                        break;
                    case "--json":
                        parsed.json = true;
                        break;
                    case "migrate":
                        parsed.setMode(Mode.MIGRATE);
                        break;
                    case "status":
                    case "--status":
                        parsed.setMode(Mode.STATUS);
                        break;
                    case "rollback":
                    case "--rollback":
                        parsed.setMode(Mode.ROLLBACK);
                        break;
                    case "repair":
                        parsed.setMode(Mode.REPAIR);
                        parsed.version = requireValue(args, ++i, "repair");
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }

            if (parsed.mode == null) {
                parsed.mode = Mode.MIGRATE;
            }
            if (parsed.json && parsed.mode != Mode.STATUS) {
                throw new IllegalArgumentException("--json is only supported by status");
            }

            return parsed;
        }

        private void setMode(final Mode mode) {
            if (this.mode != null && this.mode != mode) {
                throw new IllegalArgumentException("Only one command may be given but found " + this.mode + " and " + mode);
            }
            this.mode = mode;
        }

        private static String requireValue(final String[] args, final int index, final String flag) {
            if (index >= args.length || args[index] == null || args[index].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[index];
        }
    }
}
