package lm;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Samples new compositions by walking a {@link TransitionTable}.
 */
public class SequenceGenerator implements LanguageModel<EventGroup> {

    private static final Logger LOG = Logger.getLogger(SequenceGenerator.class.getName());

    private final TransitionTable table;
    private final Random random;

    public SequenceGenerator(TransitionTable table, Random random) {
        this.table = table;
        this.random = random;
    }

    public SequenceGenerator(TransitionTable table, long seed) {
        this(table, new Random(seed));
    }

    /**
     * Draws a start state uniformly among the table rows, then takes
     * {@code numSteps} transitions. Returns {@code numSteps + 1} groups, the
     * first being the most recent step of the start state.
     */
    public List<EventGroup> compose(int numSteps) {
        if (numSteps < 0) {
            throw new IllegalArgumentException("Number of steps must be non-negative, got " + numSteps);
        }
        StateKey state = initialState();
        List<EventGroup> composition = new ArrayList<EventGroup>(numSteps + 1);
        composition.add(state.mostRecent());

        int recurrences = 0;
        boolean leftTable = false;
        for (int step = 0; step < numSteps; step++) {
            List<Pair<EventGroup, Double>> successors = table.positiveSuccessors(state);
            if (successors.isEmpty()) {
                if (!leftTable && !table.hasState(state)) {
                    // the state never changes again, so every later step repeats too
                    LOG.warning("State " + state + " is not in the table; the remaining " + (numSteps - step)
                            + " steps repeat the previous output");
                    leftTable = true;
                }
                LOG.fine("No successor for state at step " + step + ", repeating the previous output");
                composition.add(composition.get(composition.size() - 1));
                recurrences++;
                continue;
            }
            EventGroup next = draw(successors);
            composition.add(next);
            state = state.slide(next);
        }
        if (recurrences > 0) {
            LOG.info(recurrences + " of " + numSteps + " steps had no successor and repeated the previous output");
        }
        return composition;
    }

    public StateKey initialState() {
        return table.state(random.nextInt(table.numStates()));
    }

    /**
     * Roulette-wheel draw: the first successor whose running probability
     * mass exceeds a uniform draw in [0,1).
     */
    private EventGroup draw(List<Pair<EventGroup, Double>> successors) {
        double u = random.nextDouble();
        double sumProbs = 0.0;
        for (Pair<EventGroup, Double> successor : successors) {
            sumProbs += successor.getRight();
            if (u < sumProbs) {
                return successor.getLeft();
            }
        }
        // rounding left the total just under u
        return successors.get(successors.size() - 1).getLeft();
    }

    public int contextLength() {
        return table.order();
    }

    /**
     * Draws the next group after {@code context}; repeats the most recent
     * group of the context when it has no successor.
     */
    public EventGroup sample(List<EventGroup> context) {
        StateKey state = new StateKey(context);
        List<Pair<EventGroup, Double>> successors = table.positiveSuccessors(state);
        if (successors.isEmpty()) {
            return state.mostRecent();
        }
        return draw(successors);
    }

    public double score(EventGroup entry, List<EventGroup> context) {
        return table.probability(new StateKey(context), entry);
    }

    public TransitionTable getTable() {
        return table;
    }

}
