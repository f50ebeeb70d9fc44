package org.loesak.sqlque.core.migration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Identifier of a single migration unit, e.g. {@code 007} or {@code 20240312.1}.
 *
 * <p>Versions are dot separated groups of digits. They are ordered part by part numerically,
 * which for zero-padded or timestamp versions is the same as lexical order. Two versions that
 * only differ in padding ({@code 7} and {@code 007}) order as equal and are rejected by the
 * registry as a collision.
 */
@EqualsAndHashCode
public final class MigrationVersion implements Comparable<MigrationVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile("^\\d+(\\.\\d+)*$");
    private static final String VERSION_PARTS_DELIMITER_REGEX = "\\.";

    private final String value;

    private MigrationVersion(final String value) {
        this.value = value;
    }

    @JsonCreator
    public static MigrationVersion of(final String value) {
        if (value == null || !VERSION_PATTERN.matcher(value.trim()).matches()) {
            throw new MigrationConfigurationException(
                    String.format("invalid migration version [%s]. expected dot separated digits such as [001] or [1.2.0]", value));
        }
        return new MigrationVersion(value.trim());
    }

    /**
     * Whether both versions denote the same position in the migration order.
     */
    public boolean collidesWith(final MigrationVersion that) {
        return this.compareParts(that) == 0;
    }

    @Override
    public int compareTo(final MigrationVersion that) {
        final int result = this.compareParts(that);
        if (result != 0) {
            return result;
        }

        // same numeric position, fall back to the raw text so the order stays total
        return this.value.compareTo(that.value);
    }

    private int compareParts(final MigrationVersion that) {
        final String[] thisVersionParts = this.value.split(VERSION_PARTS_DELIMITER_REGEX);
        final String[] thatVersionParts = that.value.split(VERSION_PARTS_DELIMITER_REGEX);

        final int largestNumberOfParts = Math.max(thisVersionParts.length, thatVersionParts.length);

        for (int i = 0; i < largestNumberOfParts; i++) {
            final BigInteger thisVersionPartValue = thisVersionParts.length <= i ? BigInteger.ZERO : new BigInteger(thisVersionParts[i]);
            final BigInteger thatVersionPartValue = thatVersionParts.length <= i ? BigInteger.ZERO : new BigInteger(thatVersionParts[i]);

            final int result = thisVersionPartValue.compareTo(thatVersionPartValue);
            if (result != 0) {
                return result;
            }
        }

        return 0;
    }

    @JsonValue
    @Override
    public String toString() {
        return this.value;
    }
}
