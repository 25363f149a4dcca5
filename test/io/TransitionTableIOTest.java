package io;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.lang3.math.Fraction;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import lm.EventGroup;
import lm.SequenceGenerator;
import lm.TransitionTable;
import lm.TransitionTableBuilder;
import score.Accidental;
import score.Clef;
import score.Event;
import score.EventFixtures;
import score.EventFormatException;
import score.Note;

public class TransitionTableIOTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static TransitionTable twoVoiceTable(int order) {
		List<Event> treble = new ArrayList<Event>();
		List<Event> bass = new ArrayList<Event>();
		String melody = "EGBAGFEDCDEGAGE";
		for (int i=0; i<melody.length(); ++i) {
			if (i % 4 == 3) {
				treble.add(new Event(new Note(Clef.TREBLE, melody.charAt(i), Accidental.SHARP, 4, Arrays.asList("staccato", "accent")), Fraction.getFraction(1, 8), 1));
			} else {
				treble.add(EventFixtures.quarter(melody.charAt(i), 5));
			}
			bass.add(i % 3 == 0
					? EventFixtures.chord(Fraction.ONE_HALF, 4, new Note(Clef.BASS, 'C', Accidental.NATURAL, 3), new Note(Clef.BASS, 'G', Accidental.NATURAL, 3))
					: new Event(Note.rest(Clef.BASS), Fraction.ONE_QUARTER, null));
		}
		List<List<Event>> voices = new ArrayList<List<Event>>();
		voices.add(treble);
		voices.add(bass);
		return new TransitionTableBuilder().build(voices, order);
	}

	private static void assertSameTable(TransitionTable expected, TransitionTable actual) {
		assertEquals(expected.states(), actual.states());
		assertEquals(expected.successors(), actual.successors());
		for (int row=0; row<expected.numStates(); ++row) {
			for (int col=0; col<expected.numSuccessors(); ++col) {
				assertEquals(expected.probability(row, col), actual.probability(row, col), 1e-12);
			}
		}
	}

	@Test
	public void roundTripsThroughFile() throws IOException {
		TransitionTable table = twoVoiceTable(2);
		String path = new File(tmp.getRoot(), "tms/waltz.csv").getPath();
		TransitionTableIO.writeTable(table, path);
		assertSameTable(table, TransitionTableIO.readTable(path));
	}

	@Test
	public void loadedTableComposesLikeBuiltTable() throws IOException {
		TransitionTable table = twoVoiceTable(3);
		StringWriter out = new StringWriter();
		TransitionTableIO.writeTable(table, out);
		TransitionTable loaded = TransitionTableIO.readTable(new StringReader(out.toString()));

		List<EventGroup> fromBuilt = new SequenceGenerator(table, new Random(2024)).compose(60);
		List<EventGroup> fromLoaded = new SequenceGenerator(loaded, new Random(2024)).compose(60);
		assertEquals(fromBuilt, fromLoaded);
	}

	@Test(expected = EventFormatException.class)
	public void rejectsMalformedLabels() throws IOException {
		String csv = "\"\",\"(G,2)C4|>>1/4|None\"\r\n\"(G,2)Q4|>>1/4|None\",1.0\r\n";
		TransitionTableIO.readTable(new StringReader(csv));
	}

	@Test(expected = EventFormatException.class)
	public void rejectsOversizedDurationInLabel() throws IOException {
		String csv = "\"\",\"(G,2)C4|>>1/4|99999999999\"\r\n\"(G,2)C4|>>1/4|None\",1.0\r\n";
		TransitionTableIO.readTable(new StringReader(csv));
	}

	private static class TrackingReader extends StringReader {
		boolean closed;

		TrackingReader(String s) {
			super(s);
		}

		public void close() {
			closed = true;
			super.close();
		}
	}

	@Test
	public void closesReaderAfterReading() throws IOException {
		StringWriter out = new StringWriter();
		TransitionTableIO.writeTable(twoVoiceTable(1), out);
		TrackingReader in = new TrackingReader(out.toString());
		TransitionTableIO.readTable(in);
		assertTrue(in.closed);
	}

	@Test
	public void closesReaderWhenRecordIsBad() {
		TrackingReader in = new TrackingReader("\"\",\"(G,2)C4|>>1/4|None\"\r\n\"(G,2)C4|>>1/4|None\",oops\r\n");
		try {
			TransitionTableIO.readTable(in);
			fail("bad probability accepted");
		} catch (IOException e) {
			assertTrue(in.closed);
		}
	}

	@Test
	public void rejectsRaggedRecords() {
		String csv = "\"\",\"(G,2)C4|>>1/4|None\",\"(G,2)D4|>>1/4|None\"\r\n\"(G,2)C4|>>1/4|None\",1.0\r\n";
		try {
			TransitionTableIO.readTable(new StringReader(csv));
			fail("ragged record accepted");
		} catch (IOException e) {
			assertTrue(e.getMessage().contains("cells"));
		}
	}

}
