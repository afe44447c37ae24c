package jump.email.watch.model;

import lombok.Getter;

import java.util.function.Function;

/**
 * Outcome of a call against the mailbox provider. Failures are classified once, inside the
 * provider adapter, so callers branch on {@link Outcome} instead of inspecting exceptions.
 *
 * @param <T> the type of data returned on success
 */
@Getter
public final class ProviderResult<T> {

    public enum Outcome {
        OK,
        NOT_FOUND,
        AUTH_FAILURE,
        TRANSIENT
    }

    private final Outcome outcome;
    private final T data;
    private final String errorMessage;

    private ProviderResult(Outcome outcome, T data, String errorMessage) {
        this.outcome = outcome;
        this.data = data;
        this.errorMessage = errorMessage;
    }

    public static <T> ProviderResult<T> ok(T data) {
        return new ProviderResult<>(Outcome.OK, data, null);
    }

    public static <T> ProviderResult<T> notFound(String errorMessage) {
        return new ProviderResult<>(Outcome.NOT_FOUND, null, errorMessage);
    }

    public static <T> ProviderResult<T> authFailure(String errorMessage) {
        return new ProviderResult<>(Outcome.AUTH_FAILURE, null, errorMessage);
    }

    public static <T> ProviderResult<T> transientFailure(String errorMessage) {
        return new ProviderResult<>(Outcome.TRANSIENT, null, errorMessage);
    }

    /**
     * Re-types a failed result; calling this on a successful result is a programming error.
     */
    public <U> ProviderResult<U> propagate() {
        if (outcome == Outcome.OK) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new ProviderResult<>(outcome, null, errorMessage);
    }

    public <U> ProviderResult<U> map(Function<T, U> mapper) {
        if (outcome == Outcome.OK) {
            return ok(mapper.apply(data));
        }
        return propagate();
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    public boolean isNotFound() {
        return outcome == Outcome.NOT_FOUND;
    }

    public boolean isAuthFailure() {
        return outcome == Outcome.AUTH_FAILURE;
    }

    public boolean isTransient() {
        return outcome == Outcome.TRANSIENT;
    }

    @Override
    public String toString() {
        if (outcome == Outcome.OK) {
            return "ProviderResult.ok(" + data + ")";
        }
        return "ProviderResult." + outcome + "(" + errorMessage + ")";
    }
}
