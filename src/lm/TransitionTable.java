package lm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.jblas.DoubleMatrix;

import util.Indexer;

/**
 * Row-stochastic transition probabilities from n-gram states (rows) to the
 * next event group (columns). Rows and columns are kept in lexicographic
 * order of their encoded labels, so iteration order does not depend on how
 * the table was obtained. Read-only once constructed.
 */
public class TransitionTable {

    public static final double ROW_SUM_TOLERANCE = 1e-9;

    private final Indexer<StateKey> stateIndexer;
    private final Indexer<EventGroup> successorIndexer;
    private final DoubleMatrix probs;
    private final int order;
    private final int numVoices;

    public TransitionTable(List<StateKey> states, List<EventGroup> successors, DoubleMatrix probs) {
        if (states.isEmpty() || successors.isEmpty()) {
            throw new IllegalArgumentException("A transition table needs at least one state and one successor");
        }
        if (probs.rows != states.size() || probs.columns != successors.size()) {
            throw new IllegalArgumentException("Matrix is " + probs.rows + "x" + probs.columns + " but there are "
                    + states.size() + " states and " + successors.size() + " successors");
        }
        this.order = states.get(0).order();
        this.numVoices = successors.get(0).numVoices();
        for (StateKey state : states) {
            if (state.order() != order) {
                throw new IllegalArgumentException("Mixed state orders " + order + " and " + state.order());
            }
            for (EventGroup group : state.groups) checkVoices(group);
        }
        for (EventGroup successor : successors) checkVoices(successor);

        final List<String> stateLabels = encodeAll(states);
        final List<String> successorLabels = encodeAll(successors);
        int[] rowOrder = sortedPermutation(stateLabels);
        int[] colOrder = sortedPermutation(successorLabels);

        this.stateIndexer = new Indexer<StateKey>();
        this.successorIndexer = new Indexer<EventGroup>();
        for (int r : rowOrder) {
            if (stateIndexer.contains(states.get(r))) {
                throw new IllegalArgumentException("Duplicate state " + stateLabels.get(r));
            }
            stateIndexer.getIndex(states.get(r));
        }
        for (int c : colOrder) {
            if (successorIndexer.contains(successors.get(c))) {
                throw new IllegalArgumentException("Duplicate successor " + successorLabels.get(c));
            }
            successorIndexer.getIndex(successors.get(c));
        }
        stateIndexer.lock();
        successorIndexer.lock();

        this.probs = new DoubleMatrix(rowOrder.length, colOrder.length);
        for (int i = 0; i < rowOrder.length; i++) {
            for (int j = 0; j < colOrder.length; j++) {
                this.probs.put(i, j, probs.get(rowOrder[i], colOrder[j]));
            }
        }
    }

    private void checkVoices(EventGroup group) {
        if (group.numVoices() != numVoices) {
            throw new IllegalArgumentException("Mixed voice counts " + numVoices + " and " + group.numVoices());
        }
    }

    private static List<String> encodeAll(List<?> keys) {
        List<String> labels = new ArrayList<String>(keys.size());
        for (Object key : keys) labels.add(key.toString());
        return labels;
    }

    private static int[] sortedPermutation(final List<String> labels) {
        List<Integer> indices = new ArrayList<Integer>();
        for (int i = 0; i < labels.size(); i++) indices.add(i);
        Collections.sort(indices, new Comparator<Integer>() {
            public int compare(Integer a, Integer b) {
                return labels.get(a).compareTo(labels.get(b));
            }
        });
        int[] result = new int[indices.size()];
        for (int i = 0; i < result.length; i++) result[i] = indices.get(i);
        return result;
    }

    public int order() {
        return order;
    }

    public int numVoices() {
        return numVoices;
    }

    public int numStates() {
        return stateIndexer.size();
    }

    public int numSuccessors() {
        return successorIndexer.size();
    }

    public List<StateKey> states() {
        return stateIndexer.getObjects();
    }

    public List<EventGroup> successors() {
        return successorIndexer.getObjects();
    }

    public StateKey state(int row) {
        return stateIndexer.getObject(row);
    }

    public EventGroup successor(int col) {
        return successorIndexer.getObject(col);
    }

    public boolean hasState(StateKey state) {
        return stateIndexer.contains(state);
    }

    public double probability(int row, int col) {
        return probs.get(row, col);
    }

    public double probability(StateKey state, EventGroup successor) {
        int row = stateIndexer.indexOf(state);
        int col = successorIndexer.indexOf(successor);
        if (row < 0 || col < 0) return 0.0;
        return probs.get(row, col);
    }

    /**
     * Successors of {@code state} with strictly positive probability, in
     * column order. Empty if the state is not a row of this table.
     */
    public List<Pair<EventGroup, Double>> positiveSuccessors(StateKey state) {
        List<Pair<EventGroup, Double>> result = new ArrayList<Pair<EventGroup, Double>>();
        int row = stateIndexer.indexOf(state);
        if (row < 0) return result;
        for (int col = 0; col < probs.columns; col++) {
            double p = probs.get(row, col);
            if (p > 0.0) result.add(Pair.of(successorIndexer.getObject(col), p));
        }
        return result;
    }

    public double rowSum(int row) {
        return probs.getRow(row).sum();
    }

    public boolean isRowStochastic() {
        DoubleMatrix sums = probs.rowSums();
        for (int row = 0; row < sums.length; row++) {
            if (Math.abs(sums.get(row) - 1.0) > ROW_SUM_TOLERANCE) return false;
        }
        return true;
    }

    /**
     * Copy of the probabilities, rows and columns in table order.
     */
    public DoubleMatrix toMatrix() {
        return probs.dup();
    }

    public String toString() {
        return "TransitionTable(order " + order + ", " + numVoices + " voices, " + numStates() + " states, "
                + numSuccessors() + " successors)";
    }

}
