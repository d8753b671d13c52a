package FSARegex.Validation;

import FSARegex.Model.FSA;
import FSARegex.Model.Transition;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class DeterminismChecker {

    /**
     * @param fsa - FSA declared deterministic
     * @return first transition leaving a state on a symbol already used to leave it
     */
    public static Optional<Transition> firstConflict(FSA fsa) {
        final Map<String, Set<String>> usedSymbols = new HashMap<>();
        for (Transition t : fsa.transitions()) {
            if (!usedSymbols.computeIfAbsent(t.source(), s -> new HashSet<>()).add(t.symbol())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public static boolean isNonDeterministic(FSA fsa) {
        return firstConflict(fsa).isPresent();
    }
}
