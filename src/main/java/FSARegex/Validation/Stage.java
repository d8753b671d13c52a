package FSARegex.Validation;

/**
 * Checkpoints of the validation pipeline. Stages are passed strictly in declaration order;
 * DETERMINISM_CHECKED is skipped for non-deterministic automata.
 */
public enum Stage {
    START,
    NORMALIZED,
    STATICALLY_CHECKED,
    REACHABILITY_CHECKED,
    DETERMINISM_CHECKED,
    VALID,
    REJECTED
}
