package FSARegex.Validation;

import FSARegex.Model.ErrorCode;
import FSARegex.Model.FSA;
import FSARegex.Model.Transition;
import FSARegex.Model.ValidationError;

import java.util.Optional;

/**
 * Validation pipeline: normalize, static checks, reachability, then determinism for automata
 * declared deterministic. Stops at the first failing check.
 */
public class FSAValidator {
    public static boolean DEBUG = false;

    /**
     * Normalize and validate.
     * @param fsa - FSA as delivered by the input adapter; null is rejected as malformed at START
     * @return verdict holding the normalized FSA
     */
    public static Verdict run(FSA fsa) {
        debugStage(Stage.START);
        if (fsa == null) {
            return reject(null, Stage.START, ValidationError.of(ErrorCode.MALFORMED));
        }
        final FSA normalized = Normalizer.normalize(fsa);
        debugStage(Stage.NORMALIZED);
        return check(normalized, Stage.NORMALIZED);
    }

    /**
     * Validate an FSA that was already normalized.
     * @param fsa - normalized FSA
     * @return first failure, or empty if the FSA is valid
     */
    public static Optional<ValidationError> validate(FSA fsa) {
        return check(fsa, Stage.NORMALIZED).getError();
    }

    private static Verdict check(FSA fsa, Stage stage) {
        final Optional<ValidationError> staticError = StaticValidator.check(fsa);
        if (staticError.isPresent()) {
            return reject(fsa, stage, staticError.get());
        }
        stage = Stage.STATICALLY_CHECKED;
        debugStage(stage);

        if (ReachabilityChecker.isDisjoint(fsa)) {
            return reject(fsa, stage, ValidationError.of(ErrorCode.DISJOINT));
        }
        stage = Stage.REACHABILITY_CHECKED;
        debugStage(stage);

        if (fsa.isDeterministic()) {
            final Optional<Transition> conflict = DeterminismChecker.firstConflict(fsa);
            if (conflict.isPresent()) {
                if (DEBUG) {
                    System.out.println("DEBUG: Conflicting transition: " + conflict.get());
                }
                return reject(fsa, stage, ValidationError.of(ErrorCode.NON_DETERMINISTIC));
            }
            stage = Stage.DETERMINISM_CHECKED;
            debugStage(stage);
        }
        return new Verdict(fsa, stage, null);
    }

    private static Verdict reject(FSA fsa, Stage lastPassed, ValidationError error) {
        if (DEBUG) {
            System.out.println("DEBUG: Rejected after " + lastPassed + ": " + error.message());
        }
        return new Verdict(fsa, lastPassed, error);
    }

    private static void debugStage(Stage stage) {
        if (DEBUG) {
            System.out.println("DEBUG: Reached " + stage);
        }
    }
}
