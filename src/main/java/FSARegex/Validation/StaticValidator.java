package FSARegex.Validation;

import FSARegex.Model.ErrorCode;
import FSARegex.Model.FSA;
import FSARegex.Model.Transition;
import FSARegex.Model.ValidationError;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Well-formedness checks on a normalized FSA.
 * The order of the checks is fixed: for an input with several defects, the first one listed in
 * {@link #check(FSA)} is the one reported.
 */
public class StaticValidator {

    /**
     * Run all static checks, in order:
     * <ol>
     *   <li>states missing or starting with an empty name: E1</li>
     *   <li>alphabet missing or starting with an empty symbol: E1</li>
     *   <li>repeated transition triple: E1</li>
     *   <li>initial state undeclared: E2</li>
     *   <li>accepting states missing: E3</li>
     *   <li>initial state unknown: E4</li>
     *   <li>accepting state unknown: E4</li>
     *   <li>transition endpoint unknown (source first): E4; symbol unknown: E5, or E1 if empty</li>
     * </ol>
     * @param fsa - normalized FSA
     * @return first failure, or empty if the FSA is statically well-formed
     */
    public static Optional<ValidationError> check(FSA fsa) {
        if (isBlankHead(fsa.states()) || isBlankHead(fsa.alphabet())) {
            return malformed();
        }
        if (hasRepeatedTransition(fsa.transitions())) {
            return malformed();
        }
        if (fsa.initial() == null || fsa.initial().isEmpty()) {
            return Optional.of(ValidationError.of(ErrorCode.NO_INITIAL));
        }
        if (isBlankHead(fsa.accepting())) {
            return Optional.of(ValidationError.of(ErrorCode.NO_ACCEPTING));
        }

        final List<String> states = fsa.states();
        if (!states.contains(fsa.initial())) {
            return Optional.of(ValidationError.unknownState(fsa.initial()));
        }
        for (String accepting : fsa.accepting()) {
            if (!states.contains(accepting)) {
                return Optional.of(ValidationError.unknownState(accepting));
            }
        }
        for (Transition t : fsa.transitions()) {
            if (t == null || !t.isComplete()) {
                return malformed();
            }
            if (!states.contains(t.source())) {
                return Optional.of(ValidationError.unknownState(t.source()));
            }
            if (!states.contains(t.target())) {
                return Optional.of(ValidationError.unknownState(t.target()));
            }
            if (!fsa.alphabet().contains(t.symbol())) {
                if (t.symbol().isEmpty()) {
                    return malformed();
                }
                return Optional.of(ValidationError.unknownSymbol(t.symbol()));
            }
        }
        return Optional.empty();
    }

    private static boolean isBlankHead(List<String> sequence) {
        return sequence.isEmpty() || sequence.get(0) == null || sequence.get(0).isEmpty();
    }

    static boolean hasRepeatedTransition(List<Transition> transitions) {
        final Set<Transition> seen = new HashSet<>();
        for (Transition t : transitions) {
            if (!seen.add(t)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<ValidationError> malformed() {
        return Optional.of(ValidationError.of(ErrorCode.MALFORMED));
    }
}
