package org.loesak.sqlque.examples.fleet;

import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.Sqlque;
import org.loesak.sqlque.core.SqlqueConfiguration;
import org.loesak.sqlque.core.cli.SqlqueCommand;
import org.loesak.sqlque.core.exception.SqlqueException;
import org.loesak.sqlque.examples.fleet.schedule.CancellationToken;
import org.loesak.sqlque.examples.fleet.schedule.LowStockCheck;
import org.loesak.sqlque.examples.fleet.schedule.OverdueMaintenanceCheck;
import org.loesak.sqlque.examples.fleet.schedule.ScheduledCheckLoop;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Fleet schema command line. {@code schedule [<interval seconds>]} starts the periodic checks against
 * {@code DATABASE_URL}; every other invocation is handed to {@link SqlqueCommand}.
 */
@Slf4j
public final class Main {

    private static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

    private final Map<String, String> environment;
    private final PrintStream out;
    private final PrintStream err;
    private final CancellationToken token;

    Main(final Map<String, String> environment, final PrintStream out, final PrintStream err, final CancellationToken token) {
        this.environment = environment;
        this.out = out;
        this.err = err;
        this.token = token;
    }

    public static void main(final String[] args) {
        new Main(System.getenv(), System.out, System.err, new CancellationToken())
                .run(args)
                .ifPresent(System::exit);
    }

    /**
     * @return the exit status, or empty when the scheduled checks were stopped by a JVM shutdown
     *     that is already in progress and must not be joined by {@code System.exit}
     */
    OptionalInt run(final String... args) {
        if (args.length > 0 && "schedule".equals(args[0])) {
            final int status = this.schedule(Arrays.copyOfRange(args, 1, args.length));
            return this.token.isCancelled() ? OptionalInt.empty() : OptionalInt.of(status);
        }

        return OptionalInt.of(new SqlqueCommand(FleetMigrations.registry(), this.environment, this.out, this.err).run(args));
    }

    private int schedule(final String[] args) {
        final Duration interval;
        try {
            interval = args.length == 0 ? DEFAULT_INTERVAL : Duration.ofSeconds(Long.parseLong(args[0]));
        } catch (NumberFormatException e) {
            this.err.println("Error: interval must be a number of seconds, got [" + args[0] + "]");
            return SqlqueCommand.EXIT_USAGE;
        }

        final ScheduledCheckLoop loop;
        try {
            final Sqlque sqlque = new Sqlque(SqlqueConfiguration.fromEnvironment(this.environment), FleetMigrations.registry());
            loop = new ScheduledCheckLoop(
                    sqlque,
                    List.of(new OverdueMaintenanceCheck(), new LowStockCheck()),
                    interval,
                    this.token);
        } catch (SqlqueException | IllegalArgumentException e) {
            log.error("Scheduled checks could not be configured", e);
            this.err.println("Error: " + e.getMessage());
            return SqlqueCommand.EXIT_USAGE;
        }

        final Thread hook = loop.installShutdownHook();
        try {
            loop.run();
            return SqlqueCommand.EXIT_OK;
        } catch (SqlqueException e) {
            log.error("Scheduled checks could not start", e);
            this.err.println("Error: " + e.getMessage());
            return SqlqueCommand.EXIT_FAILURE;
        } finally {
            this.removeShutdownHook(hook);
        }
    }

    private void removeShutdownHook(final Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress. Leaving shutdown hook [{}] registered", hook.getName());
        }
    }
}
