package FSARegex.Model;

/**
 * Declared kind of an automaton. Determinism is declared by the input, never inferred.
 */
public enum Kind {
    DETERMINISTIC("deterministic"),
    NON_DETERMINISTIC("non-deterministic");

    private final String token;

    Kind(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Only "deterministic" declares a deterministic automaton; any other value, or none, does not.
     * @param token - value of the "type" field, null if the field is missing
     */
    public static Kind fromToken(String token) {
        return DETERMINISTIC.token.equals(token) ? DETERMINISTIC : NON_DETERMINISTIC;
    }
}
