package org.loesak.sqlque.examples.fleet.schedule;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.Sqlque;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs a fixed set of {@link ScheduledCheck}s every interval until its {@link CancellationToken} is
 * cancelled. The token is checked before every check and while waiting between cycles.
 *
 * <p>The loop refuses to start against a schema with pending migrations. A failing check is logged
 * and does not stop the loop.
 */
@Slf4j
public class ScheduledCheckLoop {

    private final Sqlque sqlque;
    private final List<ScheduledCheck> checks;
    private final Duration interval;
    private final CancellationToken token;

    public ScheduledCheckLoop(
            @NonNull final Sqlque sqlque,
            @NonNull final List<ScheduledCheck> checks,
            @NonNull final Duration interval,
            @NonNull final CancellationToken token) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.sqlque = sqlque;
        this.checks = List.copyOf(checks);
        this.interval = interval;
        this.token = token;
    }

    /**
     * Registers a JVM shutdown hook that cancels the token.
     */
    public Thread installShutdownHook() {
        final Thread hook = new Thread(() -> {
            log.warn("Shutdown requested. Stopping scheduled checks");
            this.token.cancel();
        }, "sqlque-schedule-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    /**
     * Blocks until cancelled or interrupted.
     *
     * @return the number of completed cycles
     * @throws org.loesak.sqlque.core.exception.SchemaOutOfDateException when migrations are pending
     */
    public int run() {
        this.sqlque.ensureUpToDate();

        log.info("Starting scheduled checks [{}] every [{}]",
                this.checks.stream().map(ScheduledCheck::getName).collect(Collectors.joining(", ")),
                this.interval);

        int cycles = 0;
        try {
            while (!this.token.isCancelled()) {
                if (!this.runCycle()) {
                    break;
                }
                cycles++;

                if (this.token.sleep(this.interval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            log.warn("Scheduled checks interrupted");
            Thread.currentThread().interrupt();
        }

        log.info("Stopped scheduled checks after [{}] cycle(s)", cycles);
        return cycles;
    }

    private boolean runCycle() {
        for (ScheduledCheck check : this.checks) {
            if (this.token.isCancelled()) {
                return false;
            }
            this.runSafely(check);
        }
        return true;
    }

    private void runSafely(final ScheduledCheck check) {
        log.info("Running check [{}]", check.getName());

        try (Connection connection = this.sqlque.getDialectAdapter().getConnection()) {
            final String summary = check.run(connection);
            log.info("Completed check [{}] -> [{}]", check.getName(), summary);
        } catch (SQLException | RuntimeException e) {
            log.error("Check [{}] failed", check.getName(), e);
        }
    }
}
