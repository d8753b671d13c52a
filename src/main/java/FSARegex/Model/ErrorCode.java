package FSARegex.Model;

/**
 * Validation failures, in priority order. Codes E4 and E5 carry the offending state or symbol.
 */
public enum ErrorCode {
    MALFORMED("E1", "Input file is malformed"),
    NO_INITIAL("E2", "Initial state is not defined"),
    NO_ACCEPTING("E3", "Set of accepting states is empty"),
    UNKNOWN_STATE("E4", "A state '%s' is not in the set of states"),
    UNKNOWN_SYMBOL("E5", "A transition '%s' is not represented in the alphabet"),
    DISJOINT("E6", "Some states are disjoint"),
    NON_DETERMINISTIC("E7", "FSA is non-deterministic");

    private final String code;
    private final String template;

    ErrorCode(String code, String template) {
        this.code = code;
        this.template = template;
    }

    public String getCode() {
        return code;
    }

    public boolean hasSubject() {
        return this == UNKNOWN_STATE || this == UNKNOWN_SYMBOL;
    }

    public String format(String subject) {
        String text = hasSubject() ? String.format(template, subject) : template;
        return code + ": " + text;
    }
}
