package score;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.math.Fraction;

/**
 * Textual form of an {@link Event}:
 * <pre>
 * note1>note2>...>>numerator/denominator|duration
 * </pre>
 * where duration is an integer tick count or the literal None. The encoding
 * is injective, so it can stand in for the event wherever a string key is
 * needed.
 */
public class EventCodec {
	
	public static final String NOTE_SEPARATOR = ">";
	public static final String TIMING_SEPARATOR = ">>";
	public static final String NO_DURATION = "None";
	
	public static String encode(Event event) {
		StringBuilder buf = new StringBuilder();
		for (int i=0; i<event.notes.size(); ++i) {
			if (i > 0) buf.append(NOTE_SEPARATOR);
			buf.append(NoteCodec.encode(event.notes.get(i)));
		}
		buf.append(TIMING_SEPARATOR);
		buf.append(event.type.getNumerator()).append('/').append(event.type.getDenominator());
		buf.append('|');
		buf.append(event.duration == null ? NO_DURATION : event.duration.toString());
		return buf.toString();
	}
	
	public static Event decode(String eventStr) {
		if (eventStr == null) {
			throw new EventFormatException("Null event string");
		}
		int sep = eventStr.lastIndexOf(TIMING_SEPARATOR);
		if (sep < 0) {
			throw new EventFormatException("Invalid event string: "+eventStr);
		}
		String notesPart = eventStr.substring(0, sep);
		String timingPart = eventStr.substring(sep + TIMING_SEPARATOR.length());
		
		List<Note> notes = new ArrayList<Note>();
		if (notesPart.isEmpty()) {
			throw new EventFormatException("No notes found in event string: "+eventStr);
		}
		for (String noteStr : notesPart.split(NOTE_SEPARATOR, -1)) {
			if (noteStr.isEmpty()) {
				throw new EventFormatException("Empty note in event string: "+eventStr);
			}
			notes.add(NoteCodec.decode(noteStr));
		}
		
		int bar = timingPart.indexOf('|');
		if (bar < 0) {
			throw new EventFormatException("Invalid timing in event string: "+eventStr);
		}
		Fraction type = decodeType(timingPart.substring(0, bar), eventStr);
		String durationStr = timingPart.substring(bar+1);
		Integer duration = null;
		if (!durationStr.equals(NO_DURATION)) {
			if (!durationStr.matches("-?\\d+")) {
				throw new EventFormatException("Invalid duration \""+durationStr+"\" in event string: "+eventStr);
			}
			try {
				duration = Integer.valueOf(durationStr);
			} catch (NumberFormatException e) {
				throw new EventFormatException("Duration out of range in event string: "+eventStr, e);
			}
		}
		return new Event(notes, type, duration);
	}
	
	private static Fraction decodeType(String typeStr, String eventStr) {
		String[] split = typeStr.split("/", -1);
		if (split.length != 2 || !split[0].matches("\\d+") || !split[1].matches("\\d+")) {
			throw new EventFormatException("Invalid type \""+typeStr+"\" in event string: "+eventStr);
		}
		int numerator;
		int denominator;
		try {
			numerator = Integer.parseInt(split[0]);
			denominator = Integer.parseInt(split[1]);
		} catch (NumberFormatException e) {
			throw new EventFormatException("Type out of range in event string: "+eventStr, e);
		}
		if (numerator == 0 || denominator == 0) {
			throw new EventFormatException("Type must be a positive fraction in event string: "+eventStr);
		}
		Fraction type = Fraction.getReducedFraction(numerator, denominator);
		if (type.getNumerator() != numerator || type.getDenominator() != denominator) {
			throw new EventFormatException("Type "+typeStr+" is not in lowest terms in event string: "+eventStr);
		}
		return type;
	}

}
