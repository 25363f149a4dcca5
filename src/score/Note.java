package score;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single pitch or rest inside an {@link Event}, without its timing. The
 * clef is the last one seen on the note's staff.
 */
public class Note {
	
	public static final char REST = 'R';
	public static final String LETTERS = "ABCDEFG";
	
	private static final int[] SEMITONES = {9, 11, 0, 2, 4, 5, 7};
	
	public final Clef clef;
	public final char name;
	public final Accidental accidental;
	public final Integer octave;
	public final List<String> articulations;
	
	public Note(Clef clef, char name, Accidental accidental, Integer octave, List<String> articulations) {
		if (clef == null) throw new IllegalArgumentException("Note needs a clef");
		if (name != REST && LETTERS.indexOf(name) < 0) {
			throw new IllegalArgumentException("Illegal note name: "+name);
		}
		if (name == REST) {
			if (accidental != Accidental.NATURAL || octave != null) {
				throw new IllegalArgumentException("A rest carries neither accidental nor octave");
			}
		} else if (octave == null) {
			throw new IllegalArgumentException("Pitched note "+name+" needs an octave");
		}
		List<String> arts = new ArrayList<String>();
		if (articulations != null) {
			for (String art : articulations) {
				if (art == null || art.isEmpty() || !NoteCodec.isSafeToken(art)) {
					throw new IllegalArgumentException("Illegal articulation token: \""+art+"\"");
				}
				arts.add(art);
			}
		}
		this.clef = clef;
		this.name = name;
		this.accidental = accidental;
		this.octave = octave;
		this.articulations = Collections.unmodifiableList(arts);
	}
	
	public Note(Clef clef, char name, Accidental accidental, int octave) {
		this(clef, name, accidental, octave, Collections.<String>emptyList());
	}
	
	public static Note rest(Clef clef) {
		return new Note(clef, REST, Accidental.NATURAL, null, Collections.<String>emptyList());
	}
	
	public boolean isRest() {
		return name == REST;
	}
	
	/**
	 * MIDI key number, octave 4 starting at middle C (60). Null for rests.
	 */
	public Integer midiNumber() {
		if (isRest()) return null;
		int semitone = SEMITONES[name - 'A'] + accidental.alter;
		int midiNumber = (octave + 1) * 12 + semitone;
		if (midiNumber < 0 || midiNumber > 127) {
			throw new IllegalStateException("Note "+this+" is outside the MIDI key range");
		}
		return midiNumber;
	}
	
	public boolean equals(Object other) {
		if (other instanceof Note) {
			Note that = (Note) other;
			return this.name == that.name
					&& this.clef.equals(that.clef)
					&& this.accidental == that.accidental
					&& (this.octave == null ? that.octave == null : this.octave.equals(that.octave))
					&& this.articulations.equals(that.articulations);
		} else {
			return false;
		}
	}
	
	public int hashCode() {
		int result = clef.hashCode();
		result = 31 * result + name;
		result = 31 * result + accidental.hashCode();
		result = 31 * result + (octave == null ? 0 : octave.hashCode());
		result = 31 * result + articulations.hashCode();
		return result;
	}
	
	public String toString() {
		return NoteCodec.encode(this);
	}

}
