package FSARegex.Model;

import java.util.Objects;

public record ValidationError(ErrorCode code, String subject) {

    public ValidationError {
        Objects.requireNonNull(code);
        if (!code.hasSubject()) {
            subject = null;
        }
    }

    public static ValidationError of(ErrorCode code) {
        return new ValidationError(code, null);
    }

    public static ValidationError unknownState(String state) {
        return new ValidationError(ErrorCode.UNKNOWN_STATE, state);
    }

    public static ValidationError unknownSymbol(String symbol) {
        return new ValidationError(ErrorCode.UNKNOWN_SYMBOL, symbol);
    }

    /**
     * @return the single human-readable line for this error, e.g. "E6: Some states are disjoint"
     */
    public String message() {
        return code.format(subject);
    }

    @Override
    public String toString() {
        return message();
    }
}
