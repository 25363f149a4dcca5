package lm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import javax.sound.midi.MidiSystem;
import javax.sound.midi.Sequence;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import corpus.MissingVoiceException;
import corpus.ParsedScore;
import corpus.ScoreInfo;
import score.Event;
import score.EventFixtures;

public class MarkovInstrumentTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static ParsedScore pianoScore(String source, List<Event> upper, List<Event> lower) {
        Map<String, List<Event>> staves = new LinkedHashMap<String, List<Event>>();
        staves.put("1", upper);
        staves.put("2", lower);
        Map<String, Map<String, List<Event>>> instruments = new LinkedHashMap<String, Map<String, List<Event>>>();
        instruments.put("Piano", staves);
        return new ParsedScore(source, new ScoreInfo(4, 96), instruments);
    }

    private static List<ParsedScore> corpus() {
        return Arrays.asList(
                pianoScore("first", EventFixtures.scale(10, 4), EventFixtures.scale(12, 2)),
                pianoScore("second", EventFixtures.scale(6, 5), EventFixtures.scale(5, 3)));
    }

    @Test
    public void composesAndWritesMidi() throws Exception {
        MarkovInstrument piano = new MarkovInstrument(corpus(), 2, "piano1", Arrays.asList("1", "2"));
        assertEquals(4, piano.resolution);
        assertEquals(96, piano.tempo);

        List<EventGroup> composition = piano.compose(30, new Random(5));
        assertEquals(31, composition.size());
        assertNotNull(piano.getTable());
        assertEquals(2, composition.get(0).numVoices());

        File midi = new File(tmp.getRoot(), "out.mid");
        piano.writeMidi(composition, midi.getPath(), 150, 100, Arrays.asList("piano", "cello"));
        Sequence seq = MidiSystem.getSequence(midi);
        assertEquals(2, seq.getTracks().length);
    }

    @Test
    public void savedTableLoadsBack() throws IOException {
        String path = new File(tmp.getRoot(), "tms/piano.csv").getPath();
        MarkovInstrument builder = new MarkovInstrument(corpus(), 1, "piano1", Arrays.asList("1"));
        TransitionTable built = builder.buildTable(path, null);
        assertTrue(new File(path).exists());

        MarkovInstrument loader = new MarkovInstrument(corpus(), 1, "piano1", Arrays.asList("1"));
        TransitionTable loaded = loader.buildTable(null, path);
        assertEquals(built.states(), loaded.states());
        assertEquals(loader.compose(20, new Random(9)), builder.compose(20, new Random(9)));
    }

    @Test(expected = MissingVoiceException.class)
    public void unknownVoiceFails() throws IOException {
        new MarkovInstrument(corpus(), 1, "piano1", Arrays.asList("4")).buildTable();
    }

    @Test(expected = ChainConfigurationException.class)
    public void orderTooLargeFails() throws IOException {
        new MarkovInstrument(corpus(), 16, "piano1", Arrays.asList("1", "2")).buildTable();
    }

}
