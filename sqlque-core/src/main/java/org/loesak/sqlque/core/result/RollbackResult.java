package org.loesak.sqlque.core.result;

import lombok.NonNull;
import lombok.Value;
import org.loesak.sqlque.core.migration.MigrationVersion;

@Value
public class RollbackResult {

    public enum Outcome {
        ROLLED_BACK,
        /** the ledger entry is gone but the dialect could not fully undo the change */
        ROLLED_BACK_DEGRADED,
        NOTHING_TO_ROLL_BACK,
        FAILED
    }

    @NonNull Outcome outcome;

    MigrationVersion version;

    /** the degradation note, or the failure cause */
    String message;

    public boolean isSuccessful() {
        return this.outcome != Outcome.FAILED;
    }
}
