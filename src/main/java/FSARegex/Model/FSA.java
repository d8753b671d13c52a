package FSARegex.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finite-state automaton as declared by the input record.
 * Nothing is checked on construction; see {@link FSARegex.Validation.FSAValidator}.
 *
 * @param kind - declared kind
 * @param states - declared states, in order
 * @param alphabet - declared input symbols, in order
 * @param initial - initial state, null or empty if undeclared
 * @param accepting - accepting states, in declared order
 * @param transitions - transition triples, in declared order
 */
public record FSA(Kind kind,
                  List<String> states,
                  List<String> alphabet,
                  String initial,
                  List<String> accepting,
                  List<Transition> transitions) {

    public FSA {
        states = freeze(states);
        alphabet = freeze(alphabet);
        accepting = freeze(accepting);
        transitions = freeze(transitions);
    }

    public boolean isDeterministic() {
        return kind == Kind.DETERMINISTIC;
    }

    public FSA withSequences(List<String> states, List<String> alphabet, List<String> accepting) {
        return new FSA(kind, states, alphabet, initial, accepting, transitions);
    }

    // Copies rather than List.copyOf: null elements must survive until validation rejects them.
    private static <T> List<T> freeze(List<T> list) {
        if (list == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
