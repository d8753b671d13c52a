package FSARegex.Validation;

import FSARegex.Model.FSA;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses runs of equal, consecutive entries in the states, alphabet and accepting sequences.
 * Non-adjacent duplicates are kept: "q0,q0,q1,q0" becomes "q0,q1,q0".
 */
public class Normalizer {

    public static FSA normalize(FSA fsa) {
        return fsa.withSequences(
            collapseAdjacent(fsa.states()),
            collapseAdjacent(fsa.alphabet()),
            collapseAdjacent(fsa.accepting()));
    }

    public static List<String> collapseAdjacent(List<String> sequence) {
        final List<String> result = new ArrayList<>(sequence.size());
        for (String element : sequence) {
            if (result.isEmpty() || !Objects.equals(result.get(result.size() - 1), element)) {
                result.add(element);
            }
        }
        return result;
    }
}
