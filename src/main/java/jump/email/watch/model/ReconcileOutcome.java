package jump.email.watch.model;

import lombok.Value;

import java.math.BigInteger;

@Value
public class ReconcileOutcome {
    ReconcileStatus status;
    int processedCount;
    BigInteger cursor;

    public static ReconcileOutcome of(ReconcileStatus status, BigInteger cursor) {
        return new ReconcileOutcome(status, 0, cursor);
    }

    public static ReconcileOutcome processed(int count, BigInteger cursor) {
        return new ReconcileOutcome(ReconcileStatus.PROCESSED, count, cursor);
    }
}
