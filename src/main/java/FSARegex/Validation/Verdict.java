package FSARegex.Validation;

import FSARegex.Model.FSA;
import FSARegex.Model.ValidationError;
import FSARegex.Synthesis.RegexSynthesizer;

import java.util.Optional;

/**
 * Outcome of a validation run.
 *
 * @param fsa - the normalized FSA the checks ran on
 * @param lastPassed - last checkpoint reached before acceptance or rejection
 * @param error - first failing check, null if valid
 */
public record Verdict(FSA fsa, Stage lastPassed, ValidationError error) {

    public boolean isValid() {
        return error == null;
    }

    public Stage stage() {
        return isValid() ? Stage.VALID : Stage.REJECTED;
    }

    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return regular expression for the validated FSA
     * @throws IllegalStateException if the FSA was rejected
     */
    public String synthesize() {
        if (!isValid()) {
            throw new IllegalStateException("Cannot synthesize a rejected FSA: " + error.message());
        }
        return RegexSynthesizer.synthesize(fsa);
    }
}
