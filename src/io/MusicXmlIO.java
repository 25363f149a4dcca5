package io;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.commons.lang3.math.Fraction;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import corpus.ParsedScore;
import corpus.ScoreInfo;
import score.Accidental;
import score.Clef;
import score.Event;
import score.Note;
import score.NoteCodec;

/**
 * Reads partwise MusicXML scores, plain ({@code .xml}, {@code .musicxml})
 * or compressed ({@code .mxl}), into per-instrument, per-staff event
 * streams.
 */
public class MusicXmlIO {
	
	private static final Logger LOG = Logger.getLogger(MusicXmlIO.class.getName());
	
	public static final String CONTAINER_PATH = "META-INF/container.xml";
	public static final int DEFAULT_DIVISIONS = 1;
	
	public static final Map<String,Fraction> TYPE_FRACTIONS = new HashMap<String,Fraction>();
	static {
		TYPE_FRACTIONS.put("breve", Fraction.getFraction(2, 1));
		TYPE_FRACTIONS.put("whole", Fraction.ONE);
		TYPE_FRACTIONS.put("half", Fraction.ONE_HALF);
		TYPE_FRACTIONS.put("quarter", Fraction.ONE_QUARTER);
		TYPE_FRACTIONS.put("eighth", Fraction.getFraction(1, 8));
		TYPE_FRACTIONS.put("16th", Fraction.getFraction(1, 16));
		TYPE_FRACTIONS.put("32nd", Fraction.getFraction(1, 32));
		TYPE_FRACTIONS.put("64th", Fraction.getFraction(1, 64));
	}
	
	private static class PendingEvent {
		final List<Note> notes = new ArrayList<Note>();
		final Fraction type;
		final Integer duration;
		PendingEvent(Note first, Fraction type, Integer duration) {
			this.notes.add(first);
			this.type = type;
			this.duration = duration;
		}
		Event toEvent() {
			return new Event(notes, type, duration);
		}
	}
	
	public static ParsedScore readScore(String path) throws IOException {
		if (path.toLowerCase().endsWith(".mxl")) {
			return readCompressedScore(path);
		}
		return parseScore(parseDocument(new File(path)), path);
	}
	
	public static ParsedScore readCompressedScore(String path) throws IOException {
		ZipFile zip = new ZipFile(path);
		try {
			String scorePath = findRootFile(zip);
			ZipEntry entry = zip.getEntry(scorePath);
			if (entry == null) {
				throw new IOException("Score "+scorePath+" not found in "+path);
			}
			InputStream in = zip.getInputStream(entry);
			try {
				return parseScore(parseDocument(in), path);
			} finally {
				in.close();
			}
		} finally {
			zip.close();
		}
	}
	
	private static String findRootFile(ZipFile zip) throws IOException {
		ZipEntry container = zip.getEntry(CONTAINER_PATH);
		if (container != null) {
			InputStream in = zip.getInputStream(container);
			try {
				NodeList rootFiles = parseDocument(in).getElementsByTagName("rootfile");
				if (rootFiles.getLength() > 0) {
					String fullPath = ((Element) rootFiles.item(0)).getAttribute("full-path");
					if (!fullPath.isEmpty()) return fullPath;
				}
			} finally {
				in.close();
			}
		}
		Enumeration<? extends ZipEntry> entries = zip.entries();
		while (entries.hasMoreElements()) {
			String name = entries.nextElement().getName();
			if (!name.startsWith("META-INF/") && (name.endsWith(".xml") || name.endsWith(".musicxml"))) return name;
		}
		throw new IOException("No score file in "+zip.getName());
	}
	
	private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setNamespaceAware(false);
		dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
		dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		return dbf;
	}
	
	private static Document parseDocument(File file) throws IOException {
		try {
			return newFactory().newDocumentBuilder().parse(file);
		} catch (ParserConfigurationException e) {
			throw new IOException("Couldn't configure XML parser", e);
		} catch (SAXException e) {
			throw new IOException("Malformed MusicXML in "+file, e);
		}
	}
	
	private static Document parseDocument(InputStream in) throws IOException {
		try {
			return newFactory().newDocumentBuilder().parse(in);
		} catch (ParserConfigurationException e) {
			throw new IOException("Couldn't configure XML parser", e);
		} catch (SAXException e) {
			throw new IOException("Malformed MusicXML", e);
		}
	}
	
	public static ParsedScore parseScore(Document doc, String source) throws IOException {
		Element root = doc.getDocumentElement();
		if (!root.getTagName().equals("score-partwise")) {
			throw new IOException("Only partwise scores are supported, got <"+root.getTagName()+"> in "+source);
		}
		
		Map<String,String> partToInstrument = new LinkedHashMap<String,String>();
		Element partList = firstChild(root, "part-list");
		if (partList != null) {
			for (Element scorePart : children(partList, "score-part")) {
				String id = scorePart.getAttribute("id");
				String name = childText(scorePart, "part-name");
				if (name == null || name.trim().isEmpty()) name = id;
				name = name.trim();
				if (partToInstrument.containsValue(name)) name = name + " (" + id + ")";
				partToInstrument.put(id, name);
			}
		}
		
		Integer divisions = null;
		Integer tempo = findTempo(root);
		Map<String,Map<String,List<Event>>> instruments = new LinkedHashMap<String,Map<String,List<Event>>>();
		
		for (Element part : children(root, "part")) {
			String id = part.getAttribute("id");
			String instrument = partToInstrument.containsKey(id) ? partToInstrument.get(id) : id;
			
			Map<String,List<PendingEvent>> staves = new LinkedHashMap<String,List<PendingEvent>>();
			Element firstStaves = firstDescendant(part, "staves");
			int numStaves = firstStaves == null ? 1 : Integer.parseInt(firstStaves.getTextContent().trim());
			for (int s=1; s<=numStaves; ++s) staves.put(Integer.toString(s), new ArrayList<PendingEvent>());
			
			Map<String,Clef> clefs = new HashMap<String,Clef>();
			int partDivisions = divisions == null ? DEFAULT_DIVISIONS : divisions;
			for (Element measure : children(part, "measure")) {
				for (Element attributes : children(measure, "attributes")) {
					String divisionsText = childText(attributes, "divisions");
					if (divisionsText != null) {
						partDivisions = (int) Math.round(Double.parseDouble(divisionsText.trim()));
						if (divisions == null) divisions = partDivisions;
					}
					for (Element clef : children(attributes, "clef")) {
						String number = clef.hasAttribute("number") ? clef.getAttribute("number") : "1";
						clefs.put(number, readClef(clef));
					}
				}
				for (Element note : children(measure, "note")) {
					readNote(note, staves, clefs, partDivisions, source);
				}
			}
			
			Map<String,List<Event>> voices = new LinkedHashMap<String,List<Event>>();
			for (Map.Entry<String,List<PendingEvent>> staff : staves.entrySet()) {
				List<Event> events = new ArrayList<Event>();
				for (PendingEvent pending : staff.getValue()) events.add(pending.toEvent());
				voices.put(staff.getKey(), events);
			}
			instruments.put(instrument, voices);
			LOG.fine("Part "+id+" ("+instrument+"): "+voices.size()+" staves");
		}
		
		ScoreInfo info = new ScoreInfo(divisions == null ? DEFAULT_DIVISIONS : divisions, tempo == null ? ScoreInfo.DEFAULT_TEMPO_BPM : tempo);
		ParsedScore score = new ParsedScore(source, info, instruments);
		LOG.info("Read "+score);
		return score;
	}
	
	private static void readNote(Element note, Map<String,List<PendingEvent>> staves, Map<String,Clef> clefs, int divisions, String source) {
		String staff = childText(note, "staff");
		staff = staff == null ? "1" : staff.trim();
		List<PendingEvent> events = staves.get(staff);
		if (events == null) {
			events = new ArrayList<PendingEvent>();
			staves.put(staff, events);
		}
		Clef clef = clefs.containsKey(staff) ? clefs.get(staff) : Clef.TREBLE;
		
		String durationText = childText(note, "duration");
		Integer duration = durationText == null ? null : Integer.valueOf((int) Math.round(Double.parseDouble(durationText.trim())));
		
		Note parsed;
		if (firstChild(note, "rest") != null) {
			parsed = Note.rest(clef);
		} else {
			Element pitch = firstChild(note, "pitch");
			String step;
			String octave;
			String alter = null;
			if (pitch != null) {
				step = childText(pitch, "step");
				octave = childText(pitch, "octave");
				alter = childText(pitch, "alter");
			} else {
				Element unpitched = firstChild(note, "unpitched");
				step = unpitched == null ? null : childText(unpitched, "display-step");
				octave = unpitched == null ? null : childText(unpitched, "display-octave");
			}
			if (step == null || octave == null || step.trim().length() != 1) {
				LOG.warning("Skipping note without pitch in "+source);
				return;
			}
			Accidental accidental;
			try {
				accidental = alter == null ? Accidental.NATURAL : Accidental.fromAlter((int) Math.round(Double.parseDouble(alter.trim())));
			} catch (IllegalArgumentException e) {
				LOG.warning("Skipping note with unsupported alter "+alter+" in "+source);
				return;
			}
			parsed = new Note(clef, step.trim().charAt(0), accidental, Integer.parseInt(octave.trim()), readArticulations(note));
		}
		
		if (firstChild(note, "chord") != null && !events.isEmpty()) {
			events.get(events.size()-1).notes.add(parsed);
			return;
		}
		
		Fraction type = null;
		String typeText = childText(note, "type");
		if (typeText != null) type = TYPE_FRACTIONS.get(typeText.trim());
		if (type == null) {
			if (duration == null || duration <= 0) {
				LOG.warning("Skipping note with neither a known type nor a duration in "+source);
				return;
			}
			// measure rests and unusual types: fraction of a whole note from the tick count
			type = Fraction.getReducedFraction(duration, 4 * divisions);
		}
		events.add(new PendingEvent(parsed, type, duration));
	}
	
	private static List<String> readArticulations(Element note) {
		List<String> articulations = new ArrayList<String>();
		for (Element notations : children(note, "notations")) {
			for (Element group : children(notations, "articulations")) {
				for (Element articulation : children(group, null)) {
					if (NoteCodec.isSafeToken(articulation.getTagName())) articulations.add(articulation.getTagName());
				}
			}
		}
		return articulations;
	}
	
	private static Clef readClef(Element clef) {
		String sign = childText(clef, "sign");
		String line = childText(clef, "line");
		return new Clef(sign == null ? "G" : sign.trim(), line == null ? 0 : Integer.parseInt(line.trim()));
	}
	
	private static Integer findTempo(Element root) {
		NodeList sounds = root.getElementsByTagName("sound");
		for (int i=0; i<sounds.getLength(); ++i) {
			String tempo = ((Element) sounds.item(i)).getAttribute("tempo");
			if (!tempo.isEmpty()) return (int) Math.round(Double.parseDouble(tempo));
		}
		NodeList perMinute = root.getElementsByTagName("per-minute");
		for (int i=0; i<perMinute.getLength(); ++i) {
			try {
				return (int) Math.round(Double.parseDouble(perMinute.item(i).getTextContent().trim()));
			} catch (NumberFormatException e) {
				LOG.fine("Ignoring metronome mark "+perMinute.item(i).getTextContent());
			}
		}
		return null;
	}
	
	private static List<Element> children(Element parent, String tag) {
		List<Element> result = new ArrayList<Element>();
		NodeList nodes = parent.getChildNodes();
		for (int i=0; i<nodes.getLength(); ++i) {
			Node node = nodes.item(i);
			if (node.getNodeType() == Node.ELEMENT_NODE && (tag == null || ((Element) node).getTagName().equals(tag))) {
				result.add((Element) node);
			}
		}
		return result;
	}
	
	private static Element firstChild(Element parent, String tag) {
		List<Element> result = children(parent, tag);
		return result.isEmpty() ? null : result.get(0);
	}
	
	private static Element firstDescendant(Element parent, String tag) {
		NodeList list = parent.getElementsByTagName(tag);
		return list.getLength() == 0 ? null : (Element) list.item(0);
	}
	
	private static String childText(Element parent, String tag) {
		Element child = firstChild(parent, tag);
		return child == null ? null : child.getTextContent();
	}

}
