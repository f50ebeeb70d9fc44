package org.loesak.sqlque.core.migration;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The explicitly registered set of migration units for one application, ordered by version.
 *
 * <p>Units are handed in by the application (a static list, Spring beans, YAML resources loaded by
 * name); nothing is discovered by scanning the classpath or the file system, so the order depends
 * only on the declared versions.
 */
@Slf4j
public class MigrationRegistry {

    private final List<MigrationUnit> units;

    public MigrationRegistry(@NonNull final Collection<? extends MigrationUnit> units) {
        final List<MigrationUnit> sorted = new ArrayList<>(units.size());
        for (MigrationUnit unit : units) {
            if (unit == null) {
                throw new MigrationConfigurationException("migration registry must not contain null units");
            }
            if (unit.getVersion() == null) {
                throw new MigrationConfigurationException(String.format("migration [%s] does not declare a version", unit.getClass().getName()));
            }
            if (unit.getDisplayName() == null || unit.getDisplayName().isBlank()) {
                throw new MigrationConfigurationException(String.format("migration [%s] does not declare a display name", unit.getVersion()));
            }
            sorted.add(unit);
        }
        sorted.sort(Comparator.comparing(MigrationUnit::getVersion));

        verifyUniqueVersions(sorted);

        this.units = List.copyOf(sorted);

        log.debug("Registered [{}] migration units", this.units.size());
    }

    public static MigrationRegistry of(final MigrationUnit... units) {
        return new MigrationRegistry(Arrays.asList(units));
    }

    private static void verifyUniqueVersions(final List<MigrationUnit> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            final MigrationUnit previous = sorted.get(i - 1);
            final MigrationUnit current = sorted.get(i);
            if (previous.getVersion().collidesWith(current.getVersion())) {
                throw new MigrationConfigurationException(String.format(
                        "duplicate migration version [%s]. declared by [%s] and [%s]",
                        current.getVersion(),
                        previous.getDisplayName(),
                        current.getDisplayName()));
            }
        }
    }

    /**
     * Every registered unit in ascending version order.
     */
    public List<MigrationUnit> discover() {
        return this.units;
    }

    /**
     * Registered units whose version is not in {@code applied}, in ascending version order.
     */
    public List<MigrationUnit> pending(@NonNull final Set<MigrationVersion> applied) {
        return this.units.stream()
                         .filter(unit -> !applied.contains(unit.getVersion()))
                         .collect(Collectors.toUnmodifiableList());
    }

    public Optional<MigrationUnit> find(@NonNull final MigrationVersion version) {
        return this.units.stream()
                         .filter(unit -> unit.getVersion().equals(version))
                         .findFirst();
    }

    public int size() {
        return this.units.size();
    }
}
