package lm;

/**
 * How state windows are formed at the end of the aligned corpus.
 */
public enum WindowPolicy {

    /** One window per time step; indices wrap modulo the aligned length. */
    CYCLIC,

    /**
     * Only windows whose successor lies inside the corpus; no wraparound.
     * The state formed by the last {@code order} steps is then not a row, so
     * a generator that reaches it repeats its previous output for the rest
     * of the composition.
     */
    TRUNCATED;

    public int numWindows(int minVoiceLength, int order) {
        return this == CYCLIC ? minVoiceLength : minVoiceLength - order;
    }

}
