package main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import javax.sound.midi.MidiSystem;
import javax.sound.midi.Sequence;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import lm.WindowPolicy;

public class MainTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private static String melody() {
		StringBuilder notes = new StringBuilder();
		String steps = "CDEFGABC";
		for (int i = 0; i < steps.length(); i++) {
			notes.append("<note><pitch><step>").append(steps.charAt(i)).append("</step><octave>4</octave></pitch>")
					.append("<duration>1</duration><type>quarter</type></note>");
		}
		return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
				+ "<score-partwise version=\"3.1\">"
				+ "<part-list><score-part id=\"P1\"><part-name>Flute</part-name></score-part></part-list>"
				+ "<part id=\"P1\"><measure number=\"1\">"
				+ "<attributes><divisions>1</divisions><clef><sign>G</sign><line>2</line></clef></attributes>"
				+ notes
				+ "</measure></part></score-partwise>";
	}

	@Test
	public void parsesOptions() {
		Main main = new Main();
		assertTrue(Main.parseOptions(main, new String[] {"-score", "a.xml", "-score", "b.mxl", "-order", "3",
				"-voices", "1,2", "-window", "TRUNCATED", "-seed", "11"}));
		assertEquals(Arrays.asList("a.xml", "b.mxl"), main.scorePaths);
		assertEquals(3, main.order);
		assertEquals("1,2", main.voices);
		assertEquals(WindowPolicy.TRUNCATED, main.windowPolicy);
		assertEquals(Long.valueOf(11), main.seed);
		assertNull(main.tempo);
	}

	@Test
	public void missingScoreIsRejected() {
		assertFalse(Main.parseOptions(new Main(), new String[] {"-order", "2"}));
	}

	@Test
	public void splitsCommaLists() {
		assertEquals(Arrays.asList("piano", "cello"), Main.splitList(" piano, ,cello "));
	}

	@Test
	public void runsWholePipeline() throws Exception {
		File score = tmp.newFile("melody.xml");
		Files.write(score.toPath(), melody().getBytes(StandardCharsets.UTF_8));
		File table = new File(tmp.getRoot(), "tables/flute.csv");
		File midi = new File(tmp.getRoot(), "out/flute.mid");

		Main main = new Main();
		assertTrue(Main.parseOptions(main, new String[] {"-score", score.getPath(), "-order", "2", "-steps", "12",
				"-seed", "3", "-saveTable", table.getPath(), "-midiOut", midi.getPath(), "-instruments", "flute"}));
		main.run();

		assertTrue(table.exists());
		Sequence seq = MidiSystem.getSequence(midi);
		assertEquals(1, seq.getTracks().length);
	}

}
