package lm;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import javax.sound.midi.InvalidMidiDataException;

import corpus.AlignedCorpus;
import corpus.CorpusAggregator;
import corpus.ParsedScore;
import corpus.ScoreInfo;
import io.MidiIO;
import io.TransitionTableIO;

/**
 * A named instrument whose playing is a Markov chain of the given order
 * over the selected voices of one or more scores.
 */
public class MarkovInstrument {

    public final String name;
    public final int order;
    public final List<String> voices;
    public final int resolution;
    public final int tempo;

    private final List<ParsedScore> scores;
    private final WindowPolicy windowPolicy;
    private TransitionTable table;

    public MarkovInstrument(List<ParsedScore> scores, int order, String name, List<String> voices) {
        this(scores, order, name, voices, WindowPolicy.CYCLIC);
    }

    public MarkovInstrument(List<ParsedScore> scores, int order, String name, List<String> voices, WindowPolicy windowPolicy) {
        if (scores == null || scores.isEmpty()) {
            throw new ChainConfigurationException("An instrument needs at least one score");
        }
        this.scores = Collections.unmodifiableList(new ArrayList<ParsedScore>(scores));
        this.order = order;
        this.name = name;
        this.voices = Collections.unmodifiableList(new ArrayList<String>(voices));
        this.windowPolicy = windowPolicy;
        ScoreInfo info = scores.get(0).info;
        this.resolution = info.resolution;
        this.tempo = info.tempo;
    }

    /**
     * Loads the table from {@code loadPath} when given, otherwise builds it
     * from the scores and, if {@code savePath} is given, writes it there.
     * Either way the result replaces any previous table.
     */
    public TransitionTable buildTable(String savePath, String loadPath) throws IOException {
        if (loadPath != null) {
            this.table = TransitionTableIO.readTable(loadPath);
            return table;
        }
        AlignedCorpus corpus = CorpusAggregator.aggregate(scores, voices);
        TransitionTable built = new TransitionTableBuilder(windowPolicy).build(corpus, order);
        if (savePath != null) {
            TransitionTableIO.writeTable(built, savePath);
        }
        this.table = built;
        return table;
    }

    public TransitionTable buildTable() throws IOException {
        return buildTable(null, null);
    }

    public List<EventGroup> compose(int numSteps, Random random) throws IOException {
        if (table == null) buildTable();
        return new SequenceGenerator(table, random).compose(numSteps);
    }

    public TransitionTable getTable() {
        return table;
    }

    /**
     * Writes a composition at the score's tick resolution. A null tempo
     * falls back to the first score's tempo; null instruments play every
     * voice on piano.
     */
    public void writeMidi(List<EventGroup> composition, String path, Integer tempoBpm, int velocity, List<String> instruments)
            throws IOException, InvalidMidiDataException {
        MidiIO.writeMidiFile(composition, path, resolution, tempoBpm == null ? tempo : tempoBpm, velocity, instruments);
    }

    public String toString() {
        return "MarkovInstrument(" + name + ", order " + order + ", voices " + voices + ", " + scores.size() + " scores)";
    }

}
