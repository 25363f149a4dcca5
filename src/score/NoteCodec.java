package score;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual form of a {@link Note}:
 * <pre>
 * (clefSign,clefLine)LetterAccidentalOctave|art1,art2,...
 * </pre>
 * Rests use the letter R and leave accidental and octave empty.
 */
public class NoteCodec {
	
	public static final String RESERVED = "(),|>&+";
	
	public static boolean isSafeToken(String token) {
		for (int i=0; i<token.length(); ++i) {
			char c = token.charAt(i);
			if (RESERVED.indexOf(c) >= 0 || Character.isWhitespace(c)) return false;
		}
		return true;
	}
	
	public static String encode(Note note) {
		StringBuilder buf = new StringBuilder();
		buf.append(note.clef.toString());
		buf.append(note.name);
		buf.append(note.accidental.symbol);
		if (note.octave != null) buf.append(note.octave);
		buf.append('|');
		buf.append(String.join(",", note.articulations));
		return buf.toString();
	}
	
	public static Note decode(String noteStr) {
		if (noteStr == null || noteStr.isEmpty()) {
			throw new EventFormatException("Empty note string");
		}
		
		int clefEnd = noteStr.indexOf(')');
		if (!noteStr.startsWith("(") || clefEnd < 0) {
			throw new EventFormatException("Missing clef in note string: "+noteStr);
		}
		Clef clef = decodeClef(noteStr.substring(1, clefEnd), noteStr);
		
		String remainder = noteStr.substring(clefEnd+1);
		int artStart = remainder.indexOf('|');
		if (artStart < 0) {
			throw new EventFormatException("Missing articulation separator in note string: "+noteStr);
		}
		String pitchPart = remainder.substring(0, artStart);
		String articulationPart = remainder.substring(artStart+1);
		if (pitchPart.isEmpty()) {
			throw new EventFormatException("Missing pitch in note string: "+noteStr);
		}
		
		char name = pitchPart.charAt(0);
		if (name != Note.REST && Note.LETTERS.indexOf(name) < 0) {
			throw new EventFormatException("Illegal note letter '"+name+"' in note string: "+noteStr);
		}
		String afterName = pitchPart.substring(1);
		
		List<String> articulations = new ArrayList<String>();
		for (String art : articulationPart.split(",")) {
			if (!art.isEmpty()) articulations.add(art);
		}
		
		try {
			if (name == Note.REST) {
				if (!afterName.isEmpty()) {
					throw new EventFormatException("Rest with pitch information in note string: "+noteStr);
				}
				return new Note(clef, name, Accidental.NATURAL, null, articulations);
			}
			Accidental accidental = Accidental.longestPrefixOf(afterName);
			String octaveStr = afterName.substring(accidental.symbol.length());
			if (!octaveStr.matches("-?\\d+")) {
				throw new EventFormatException("Illegal octave \""+octaveStr+"\" in note string: "+noteStr);
			}
			return new Note(clef, name, accidental, Integer.valueOf(octaveStr), articulations);
		} catch (EventFormatException e) {
			throw e;
		} catch (IllegalArgumentException e) {
			throw new EventFormatException("Illegal note string: "+noteStr, e);
		}
	}
	
	private static Clef decodeClef(String clefContent, String noteStr) {
		String[] split = clefContent.split(",", -1);
		if (split.length != 2 || split[0].isEmpty()) {
			throw new EventFormatException("Malformed clef in note string: "+noteStr);
		}
		try {
			return new Clef(split[0], Integer.parseInt(split[1].trim()));
		} catch (IllegalArgumentException e) {
			throw new EventFormatException("Malformed clef in note string: "+noteStr, e);
		}
	}

}
