package lm;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.jblas.DoubleMatrix;

import corpus.AlignedCorpus;
import score.Event;
import util.Indexer;

/**
 * Counts order-n transitions over the aligned time steps of a corpus and
 * normalizes them into a {@link TransitionTable}.
 */
public class TransitionTableBuilder {

    private static final Logger LOG = Logger.getLogger(TransitionTableBuilder.class.getName());

    private final WindowPolicy windowPolicy;

    public TransitionTableBuilder() {
        this(WindowPolicy.CYCLIC);
    }

    public TransitionTableBuilder(WindowPolicy windowPolicy) {
        this.windowPolicy = windowPolicy;
    }

    public TransitionTable build(List<List<Event>> voices, int order) {
        return build(AlignedCorpus.of(voices), order);
    }

    public TransitionTable build(AlignedCorpus corpus, int order) {
        if (corpus.numVoices() == 0) {
            throw new ChainConfigurationException("At least one voice must be selected");
        }
        if (order < 1) {
            throw new ChainConfigurationException("Order must be positive, got " + order);
        }
        int minVoiceLength = corpus.minVoiceLength();
        if (order >= minVoiceLength) {
            throw new ChainConfigurationException("Order (" + order + ") must be less than the minimum voice length ("
                    + minVoiceLength + ")");
        }

        Indexer<StateKey> stateIndexer = new Indexer<StateKey>();
        Indexer<EventGroup> successorIndexer = new Indexer<EventGroup>();
        int numWindows = windowPolicy.numWindows(minVoiceLength, order);
        List<StateKey> windowStates = new ArrayList<StateKey>(numWindows);
        List<EventGroup> windowSuccessors = new ArrayList<EventGroup>(numWindows);
        for (int i = 0; i < numWindows; i++) {
            List<EventGroup> context = new ArrayList<EventGroup>(order);
            for (int j = 0; j < order; j++) {
                context.add(groupAt(corpus, (i + j) % minVoiceLength));
            }
            StateKey state = new StateKey(context);
            EventGroup next = groupAt(corpus, (i + order) % minVoiceLength);
            stateIndexer.getIndex(state);
            successorIndexer.getIndex(next);
            windowStates.add(state);
            windowSuccessors.add(next);
        }

        DoubleMatrix counts = DoubleMatrix.zeros(stateIndexer.size(), successorIndexer.size());
        for (int i = 0; i < numWindows; i++) {
            int row = stateIndexer.getIndex(windowStates.get(i));
            int col = successorIndexer.getIndex(windowSuccessors.get(i));
            counts.put(row, col, counts.get(row, col) + 1);
        }

        LOG.info("Order " + order + " over " + corpus.numVoices() + " voices and " + minVoiceLength + " steps: "
                + stateIndexer.size() + " states, " + successorIndexer.size() + " unique successors");
        return new TransitionTable(stateIndexer.getObjects(), successorIndexer.getObjects(), normalizeRows(counts));
    }

    private static EventGroup groupAt(AlignedCorpus corpus, int t) {
        return new EventGroup(corpus.eventsAt(t));
    }

    /**
     * Divides every row by its sum. A row summing to zero is first filled
     * with ones, which makes it uniform over all successors.
     */
    public static DoubleMatrix normalizeRows(DoubleMatrix counts) {
        DoubleMatrix probs = counts.dup();
        DoubleMatrix sums = probs.rowSums();
        for (int row = 0; row < probs.rows; row++) {
            if (sums.get(row) == 0.0) {
                LOG.fine("Row " + row + " has no observed successor, treating it as recurrent");
                for (int col = 0; col < probs.columns; col++) probs.put(row, col, 1.0);
            }
        }
        return probs.diviColumnVector(probs.rowSums());
    }

}
