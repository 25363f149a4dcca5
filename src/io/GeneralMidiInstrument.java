package io;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * General MIDI programs addressable by name on the command line.
 */
public enum GeneralMidiInstrument {
	
	PIANO(0), BRIGHT_PIANO(1), ELECTRIC_PIANO(4), HARPSICHORD(6), CELESTA(8), GLOCKENSPIEL(9),
	MUSIC_BOX(10), VIBRAPHONE(11), MARIMBA(12), XYLOPHONE(13), CHURCH_ORGAN(19), ORGAN(16),
	ACCORDION(21), HARMONICA(22), GUITAR(24), STEEL_GUITAR(25), ELECTRIC_GUITAR(27), BASS(32),
	VIOLIN(40), VIOLA(41), CELLO(42), CONTRABASS(43), HARP(46), TIMPANI(47), STRINGS(48),
	CHOIR(52), TRUMPET(56), TROMBONE(57), TUBA(58), FRENCH_HORN(60), SOPRANO_SAX(64),
	SAXOPHONE(65), TENOR_SAX(66), OBOE(68), ENGLISH_HORN(69), BASSOON(70), CLARINET(71),
	PICCOLO(72), FLUTE(73), RECORDER(74), PAN_FLUTE(75), OCARINA(79),
	DRUMS(0, true);
	
	public static final int PERCUSSION_CHANNEL = 9;
	
	public final int program;
	public final boolean percussion;
	
	private GeneralMidiInstrument(int program) {
		this(program, false);
	}
	
	private GeneralMidiInstrument(int program, boolean percussion) {
		this.program = program;
		this.percussion = percussion;
	}
	
	public static GeneralMidiInstrument forName(String name) {
		String key = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
		for (GeneralMidiInstrument instrument : values()) {
			if (instrument.name().equals(key)) return instrument;
		}
		throw new IllegalArgumentException("Unknown instrument '"+name+"'. Available options: "+availableNames());
	}
	
	public static List<String> availableNames() {
		List<String> names = new ArrayList<String>();
		for (GeneralMidiInstrument instrument : values()) names.add(instrument.name().toLowerCase(Locale.ROOT));
		return names;
	}

}
