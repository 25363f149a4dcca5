package main;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.LogManager;

import javax.sound.midi.InvalidMidiDataException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import corpus.ParsedScore;
import io.MusicXmlIO;
import lm.EventGroup;
import lm.MarkovInstrument;
import lm.TransitionTable;
import lm.WindowPolicy;

public class Main implements Runnable {

	@Option(name = "-score", usage = "MusicXML score (.xml or .mxl), repeat for a corpus", required = true)
	public List<String> scorePaths = new ArrayList<String>();
	@Option(name = "-voices", usage = "comma-separated staff ids to model")
	public String voices = "1";
	@Option(name = "-order", usage = "n-gram order of the chain")
	public int order = 1;
	@Option(name = "-steps", usage = "number of transitions to sample")
	public int steps = 50;
	@Option(name = "-seed", usage = "random seed, unseeded if absent")
	public Long seed = null;
	@Option(name = "-window", usage = "CYCLIC or TRUNCATED state windows")
	public WindowPolicy windowPolicy = WindowPolicy.CYCLIC;
	@Option(name = "-name", usage = "instrument name")
	public String name = "piano1";
	@Option(name = "-loadTable", usage = "CSV transition table to load instead of building one")
	public String loadTablePath = null;
	@Option(name = "-saveTable", usage = "where to write the built transition table")
	public String saveTablePath = null;
	@Option(name = "-midiOut", usage = "MIDI file to write")
	public String midiOutPath = "output/composition.mid";
	@Option(name = "-tempo", usage = "tempo in BPM, defaults to the first score's")
	public Integer tempo = null;
	@Option(name = "-velocity", usage = "note-on velocity, 0-127")
	public int velocity = 127;
	@Option(name = "-instruments", usage = "comma-separated General MIDI names, one per voice or one for all")
	public String instruments = null;

	public void run() {
		try {
			List<ParsedScore> scores = new ArrayList<ParsedScore>();
			for (String path : scorePaths) {
				scores.add(MusicXmlIO.readScore(path));
			}
			List<String> voiceIds = splitList(voices);
			MarkovInstrument instrument = new MarkovInstrument(scores, order, name, voiceIds, windowPolicy);
			TransitionTable table = instrument.buildTable(saveTablePath, loadTablePath);
			System.out.println("Transition table: " + table.numStates() + " states, " + table.numSuccessors() + " successors");

			Random random = seed == null ? new Random() : new Random(seed);
			List<EventGroup> composition = instrument.compose(steps, random);
			System.out.println("Composed " + composition.size() + " time steps");

			List<String> instrumentNames = null;
			if (instruments != null) {
				instrumentNames = splitList(instruments);
				if (instrumentNames.size() == 1 && table.numVoices() > 1) {
					instrumentNames = Collections.nCopies(table.numVoices(), instrumentNames.get(0));
				}
			}
			instrument.writeMidi(composition, midiOutPath, tempo, velocity, instrumentNames);
			System.out.println("MIDI written to " + midiOutPath);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		} catch (InvalidMidiDataException e) {
			throw new IllegalStateException("Couldn't build MIDI sequence", e);
		}
	}

	public static List<String> splitList(String commaSeparated) {
		List<String> result = new ArrayList<String>();
		for (String item : commaSeparated.split(",")) {
			if (!item.trim().isEmpty()) result.add(item.trim());
		}
		return result;
	}

	public static boolean parseOptions(Main main, String[] args) {
		CmdLineParser parser = new CmdLineParser(main);
		try {
			parser.parseArgument(args);
			return true;
		} catch (CmdLineException e) {
			System.err.println(e.getMessage());
			parser.printUsage(System.err);
			return false;
		}
	}

	private static void configureLogging() {
		InputStream config = Main.class.getResourceAsStream("/logging.properties");
		if (config == null) return;
		try {
			LogManager.getLogManager().readConfiguration(config);
			config.close();
		} catch (IOException e) {
			System.err.println("Couldn't read logging configuration: " + e.getMessage());
		}
	}

	public static void main(String[] args) {
		configureLogging();
		Main main = new Main();
		if (!parseOptions(main, args)) System.exit(1);
		main.run();
	}

}
