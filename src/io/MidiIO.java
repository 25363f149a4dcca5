package io;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.MetaMessage;
import javax.sound.midi.MidiEvent;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.Sequence;
import javax.sound.midi.ShortMessage;
import javax.sound.midi.Track;

import lm.EventGroup;
import score.Event;
import score.Note;

/**
 * Renders compositions as Standard MIDI sequences, one track per voice.
 */
public class MidiIO {
	
	private static final Logger LOG = Logger.getLogger(MidiIO.class.getName());
	
	public static final int MIDI_TEMPO = 0x51;
	public static final int MIDI_END_OF_TRACK = 0x2f;
	public static final int MAX_CHANNELS = 16;
	public static final int DEFAULT_VELOCITY = 127;
	public static final String DEFAULT_INSTRUMENT = "piano";
	
	public static Sequence fromComposition(List<EventGroup> composition, int resolution, int tempoBpm, int velocity, List<String> instruments) throws InvalidMidiDataException {
		return fromVoices(splitVoices(composition), resolution, tempoBpm, velocity, instruments);
	}
	
	public static Sequence fromVoice(List<Event> events, int resolution, int tempoBpm, int velocity, String instrument) throws InvalidMidiDataException {
		List<List<Event>> voices = new ArrayList<List<Event>>();
		voices.add(events);
		return fromVoices(voices, resolution, tempoBpm, velocity, instrument == null ? null : Collections.singletonList(instrument));
	}
	
	/**
	 * Regroups time steps into one event list per voice.
	 */
	public static List<List<Event>> splitVoices(List<EventGroup> composition) {
		if (composition == null || composition.isEmpty()) {
			throw new IllegalArgumentException("No events supplied for MIDI export");
		}
		int numVoices = composition.get(0).numVoices();
		List<List<Event>> voices = new ArrayList<List<Event>>();
		for (int v=0; v<numVoices; ++v) voices.add(new ArrayList<Event>());
		for (EventGroup step : composition) {
			if (step.numVoices() != numVoices) {
				throw new IllegalArgumentException("All time steps must contain the same number of voices ("+numVoices+"), found "+step.numVoices());
			}
			for (int v=0; v<numVoices; ++v) voices.get(v).add(step.get(v));
		}
		return voices;
	}
	
	public static Sequence fromVoices(List<List<Event>> voices, int resolution, int tempoBpm, int velocity, List<String> instruments) throws InvalidMidiDataException {
		if (voices == null || voices.isEmpty() || voices.get(0).isEmpty()) {
			throw new IllegalArgumentException("No events supplied for MIDI export");
		}
		if (resolution <= 0) throw new IllegalArgumentException("Tick resolution must be positive, got "+resolution);
		if (tempoBpm <= 0) throw new IllegalArgumentException("Tempo must be positive, got "+tempoBpm);
		if (velocity < 0 || velocity > 127) throw new IllegalArgumentException("Velocity must be in 0..127, got "+velocity);
		
		List<String> instrumentNames;
		if (instruments == null) {
			instrumentNames = Collections.nCopies(voices.size(), DEFAULT_INSTRUMENT);
		} else if (instruments.size() != voices.size()) {
			throw new IllegalArgumentException("Number of instruments ("+instruments.size()+") must match the number of voices ("+voices.size()+")");
		} else {
			instrumentNames = instruments;
		}
		
		Sequence seq = new Sequence(Sequence.PPQ, resolution);
		int melodicChannel = 0;
		for (int v=0; v<voices.size(); ++v) {
			GeneralMidiInstrument instrument = GeneralMidiInstrument.forName(instrumentNames.get(v));
			int channel;
			if (instrument.percussion) {
				channel = GeneralMidiInstrument.PERCUSSION_CHANNEL;
			} else {
				channel = melodicChannel;
				if (channel == GeneralMidiInstrument.PERCUSSION_CHANNEL) {
					channel++;
					melodicChannel = channel;
				}
				melodicChannel++;
			}
			if (channel >= MAX_CHANNELS) {
				throw new IllegalArgumentException("Too many melodic voices for "+MAX_CHANNELS+" MIDI channels");
			}
			
			Track track = seq.createTrack();
			if (v == 0) {
				track.add(new MidiEvent(tempoMessage(tempoBpm), 0));
			}
			if (!instrument.percussion) {
				track.add(new MidiEvent(new ShortMessage(ShortMessage.PROGRAM_CHANGE, channel, instrument.program, 0), 0));
			}
			writeVoiceTrack(voices.get(v), track, channel, velocity, resolution);
		}
		return seq;
	}
	
	/**
	 * Appends one voice to a track. Rests only move the time cursor, so
	 * consecutive rests add up to the delay before the next sounding event.
	 * All notes of a chord start and stop together.
	 */
	public static void writeVoiceTrack(List<Event> events, Track track, int channel, int velocity, int resolution) throws InvalidMidiDataException {
		long tick = 0;
		for (Event event : events) {
			int duration = event.durationTicks(resolution);
			List<Integer> pitches = new ArrayList<Integer>();
			for (Note note : event.notes) {
				Integer midiNumber = note.midiNumber();
				if (midiNumber != null) pitches.add(midiNumber);
			}
			if (pitches.isEmpty()) {
				tick += duration;
				continue;
			}
			for (int pitch : pitches) {
				track.add(new MidiEvent(new ShortMessage(ShortMessage.NOTE_ON, channel, pitch, velocity), tick));
			}
			for (int pitch : pitches) {
				track.add(new MidiEvent(new ShortMessage(ShortMessage.NOTE_OFF, channel, pitch, 0), tick + duration));
			}
			tick += duration;
		}
		track.add(new MidiEvent(new MetaMessage(MIDI_END_OF_TRACK, new byte[0], 0), tick));
	}
	
	public static MetaMessage tempoMessage(int bpm) throws InvalidMidiDataException {
		int microsecondsPerQuarter = 60000000 / bpm;
		byte[] data = new byte[] {(byte) (microsecondsPerQuarter >> 16), (byte) (microsecondsPerQuarter >> 8), (byte) microsecondsPerQuarter};
		return new MetaMessage(MIDI_TEMPO, data, data.length);
	}
	
	public static void writeMidiFile(Sequence seq, String path) throws IOException {
		File file = new File(path);
		if (file.getAbsoluteFile().getParentFile() != null) file.getAbsoluteFile().getParentFile().mkdirs();
		MidiSystem.write(seq, MidiSystem.getMidiFileTypes(seq)[0], file);
		LOG.info("Wrote "+seq.getTracks().length+" tracks to "+path);
	}
	
	public static void writeMidiFile(List<EventGroup> composition, String path, int resolution, int tempoBpm, int velocity, List<String> instruments) throws IOException, InvalidMidiDataException {
		writeMidiFile(fromComposition(composition, resolution, tempoBpm, velocity, instruments), path);
	}

}
