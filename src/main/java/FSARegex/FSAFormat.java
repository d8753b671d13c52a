package FSARegex;

import FSARegex.Model.FSA;
import FSARegex.Model.Kind;
import FSARegex.Model.Transition;
import net.automatalib.exception.FormatException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reader for the six-line FSA record:
 * <pre>
 * type=[deterministic]
 * states=[q0,q1]
 * alphabet=[a,b]
 * initial=[q0]
 * accepting=[q1]
 * transitions=[q0>a>q1,q1>b>q0]
 * </pre>
 * Only the line count is checked here. Missing, empty or ill-shaped fields are left for
 * {@link FSARegex.Validation.FSAValidator} to report.
 */
public class FSAFormat {
    public static final int LINE_COUNT = 6;

    private static final String TYPE = "type=[";
    private static final String STATES = "states=[";
    private static final String ALPHABET = "alphabet=[";
    private static final String INITIAL = "initial=[";
    private static final String ACCEPTING = "accepting=[";
    private static final String TRANSITIONS = "transitions=[";

    public static FSA parse(List<String> rawLines) throws FormatException {
        final List<String> lines = rawLines.stream().map(String::strip).collect(Collectors.toList());
        if (lines.size() != LINE_COUNT) {
            throw new FormatException("Expected " + LINE_COUNT + " lines, found " + lines.size());
        }

        String type = null;
        String initial = null;
        List<String> states = List.of();
        List<String> alphabet = List.of();
        List<String> accepting = List.of();
        List<Transition> transitions = List.of();

        // lines matching no key are ignored
        for (String line : lines) {
            if (line.startsWith(TYPE)) {
                type = value(line);
            } else if (line.startsWith(STATES)) {
                states = splitList(value(line));
            } else if (line.startsWith(ALPHABET)) {
                alphabet = splitList(value(line));
            } else if (line.startsWith(INITIAL)) {
                initial = value(line);
            } else if (line.startsWith(ACCEPTING)) {
                accepting = splitList(value(line));
            } else if (line.startsWith(TRANSITIONS)) {
                transitions = parseTransitions(value(line));
            }
        }

        return new FSA(Kind.fromToken(type), states, alphabet, initial, accepting, transitions);
    }

    public static FSA read(InputStream is) throws IOException, FormatException {
        final BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        final List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        return parse(lines);
    }

    public static FSA getFSAFile(String filePath) throws IOException, FormatException {
        try (InputStream is = Files.newInputStream(Path.of(filePath))) {
            return read(is);
        }
    }

    /**
     * Text between the first and second '=', without surrounding brackets.
     */
    static String value(String line) {
        final int from = line.indexOf('=') + 1;
        final int to = line.indexOf('=', from);
        final String raw = to < 0 ? line.substring(from) : line.substring(from, to);
        int begin = 0;
        int end = raw.length();
        while (begin < end && isBracket(raw.charAt(begin))) {
            begin++;
        }
        while (end > begin && isBracket(raw.charAt(end - 1))) {
            end--;
        }
        return raw.substring(begin, end);
    }

    private static boolean isBracket(char c) {
        return c == '[' || c == ']';
    }

    // "" becomes [""], which validation reports as an empty field
    static List<String> splitList(String value) {
        return Arrays.asList(value.split(",", -1));
    }

    /**
     * Tokens that are not a source>symbol>target triple, including the lone "" of "[]",
     * become {@link Transition#unparsed(String)} entries and are reported by validation in order.
     */
    static List<Transition> parseTransitions(String value) {
        final List<Transition> transitions = new ArrayList<>();
        for (String token : value.split(",", -1)) {
            final String[] parts = token.split(">", -1);
            if (parts.length == 3) {
                transitions.add(new Transition(parts[0], parts[1], parts[2]));
            } else {
                transitions.add(Transition.unparsed(token));
            }
        }
        return transitions;
    }
}
