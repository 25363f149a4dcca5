package score;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.math.Fraction;

/**
 * One note, rest or chord together with its rhythmic type (a fraction of a
 * whole note) and, when the score gives one, its duration in ticks.
 */
public class Event {
	
	public final List<Note> notes;
	public final Fraction type;
	public final Integer duration;
	
	public Event(List<Note> notes, Fraction type, Integer duration) {
		if (notes == null || notes.isEmpty()) {
			throw new IllegalArgumentException("Event requires at least one note/rest entry");
		}
		if (type == null || type.compareTo(Fraction.ZERO) <= 0) {
			throw new IllegalArgumentException("Event type must be a positive fraction, got "+type);
		}
		this.notes = Collections.unmodifiableList(new ArrayList<Note>(notes));
		this.type = type.reduce();
		this.duration = duration;
	}
	
	public Event(Note note, Fraction type, Integer duration) {
		this(Collections.singletonList(note), type, duration);
	}
	
	public boolean isChord() {
		return notes.size() > 1;
	}
	
	public boolean isRest() {
		for (Note note : notes) {
			if (!note.isRest()) return false;
		}
		return true;
	}
	
	/**
	 * Length in ticks: the explicit duration when present, otherwise the
	 * type scaled by the tick resolution.
	 */
	public int durationTicks(int resolution) {
		if (duration != null) return duration;
		return type.multiplyBy(Fraction.getFraction(resolution, 1)).intValue();
	}
	
	public boolean equals(Object other) {
		if (other instanceof Event) {
			Event that = (Event) other;
			return this.notes.equals(that.notes)
					&& this.type.equals(that.type)
					&& (this.duration == null ? that.duration == null : this.duration.equals(that.duration));
		} else {
			return false;
		}
	}
	
	public int hashCode() {
		int result = notes.hashCode();
		result = 31 * result + type.hashCode();
		result = 31 * result + (duration == null ? 0 : duration.hashCode());
		return result;
	}
	
	public String toString() {
		return EventCodec.encode(this);
	}

}
