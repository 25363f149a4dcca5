package score;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class NoteTest {

	@Test
	public void encodesPitchedNoteWithArticulations() {
		Note note = new Note(new Clef("F", 4), 'G', Accidental.SHARP, 3, Arrays.asList("staccato", "accent"));
		assertEquals("(F,4)G#3|staccato,accent", NoteCodec.encode(note));
	}

	@Test
	public void encodesRest() {
		assertEquals("(G,2)R|", NoteCodec.encode(Note.rest(Clef.TREBLE)));
	}

	@Test
	public void roundTripsEveryAccidental() {
		for (Accidental accidental : Accidental.values()) {
			Note note = new Note(Clef.BASS, 'B', accidental, 2, Collections.singletonList("tenuto"));
			assertEquals(note, NoteCodec.decode(NoteCodec.encode(note)));
		}
	}

	@Test
	public void roundTripsNegativeOctaveAndEmptyArticulations() {
		Note note = new Note(new Clef("C", 3), 'A', Accidental.DOUBLE_FLAT, -1);
		Note decoded = NoteCodec.decode(NoteCodec.encode(note));
		assertEquals(note, decoded);
		assertTrue(decoded.articulations.isEmpty());
	}

	@Test
	public void decodesDoubleFlatGreedily() {
		Note note = NoteCodec.decode("(G,2)Ebb5|");
		assertEquals(Accidental.DOUBLE_FLAT, note.accidental);
		assertEquals(Integer.valueOf(5), note.octave);
	}

	@Test
	public void decodesFlatOfNoteB() {
		Note note = NoteCodec.decode("(G,2)Bb4|");
		assertEquals('B', note.name);
		assertEquals(Accidental.FLAT, note.accidental);
	}

	@Test
	public void decodesRest() {
		Note rest = NoteCodec.decode("(F,4)R|");
		assertTrue(rest.isRest());
		assertNull(rest.octave);
		assertEquals(Clef.BASS, rest.clef);
	}

	@Test(expected = EventFormatException.class)
	public void rejectsIllegalLetter() {
		NoteCodec.decode("(G,2)H4|");
	}

	@Test(expected = EventFormatException.class)
	public void rejectsMissingArticulationSeparator() {
		NoteCodec.decode("(G,2)C4");
	}

	@Test(expected = EventFormatException.class)
	public void rejectsMissingClef() {
		NoteCodec.decode("C4|");
	}

	@Test(expected = EventFormatException.class)
	public void rejectsPitchedNoteWithoutOctave() {
		NoteCodec.decode("(G,2)C#|");
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsArticulationWithDelimiter() {
		new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 4, Collections.singletonList("a,b"));
	}

	@Test
	public void equalityCoversEveryField() {
		Note base = new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 4);
		assertEquals(base, new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 4));
		assertNotEquals(base, new Note(Clef.BASS, 'C', Accidental.NATURAL, 4));
		assertNotEquals(base, new Note(Clef.TREBLE, 'C', Accidental.SHARP, 4));
		assertNotEquals(base, new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 5));
		assertNotEquals(base, new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 4, Collections.singletonList("staccato")));
		assertFalse(base.isRest());
	}

	@Test
	public void midiNumbers() {
		assertEquals(Integer.valueOf(60), new Note(Clef.TREBLE, 'C', Accidental.NATURAL, 4).midiNumber());
		assertEquals(Integer.valueOf(69), new Note(Clef.TREBLE, 'A', Accidental.NATURAL, 4).midiNumber());
		assertEquals(Integer.valueOf(59), new Note(Clef.TREBLE, 'C', Accidental.FLAT, 4).midiNumber());
		assertEquals(Integer.valueOf(64), new Note(Clef.TREBLE, 'D', Accidental.DOUBLE_SHARP, 4).midiNumber());
		assertNull(Note.rest(Clef.TREBLE).midiNumber());
	}

}
