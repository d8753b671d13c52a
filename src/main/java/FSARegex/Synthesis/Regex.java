package FSARegex.Synthesis;

/**
 * Tokens of the synthesized expressions.
 */
public final class Regex {
    public static final String EPSILON = "eps";
    public static final String EMPTY_SET = "{}";
    public static final String UNION = "|";
    public static final String STAR = "*";

    private Regex() {}

    static String group(String expr) {
        return "(" + expr + ")";
    }

    /**
     * (left)(loop)*(right)|(bypass)
     */
    static String eliminate(String left, String loop, String right, String bypass) {
        return group(left) + group(loop) + STAR + group(right) + UNION + group(bypass);
    }
}
