package corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import score.Event;

/**
 * The event streams of one score, keyed by instrument name and then by
 * staff (voice) id, in document order.
 */
public class ParsedScore {
	
	public final String source;
	public final ScoreInfo info;
	private final Map<String,Map<String,List<Event>>> instruments;
	
	public ParsedScore(String source, ScoreInfo info, Map<String,Map<String,List<Event>>> instruments) {
		this.source = source;
		this.info = info;
		Map<String,Map<String,List<Event>>> copy = new LinkedHashMap<String,Map<String,List<Event>>>();
		for (Map.Entry<String,Map<String,List<Event>>> inst : instruments.entrySet()) {
			Map<String,List<Event>> voices = new LinkedHashMap<String,List<Event>>();
			for (Map.Entry<String,List<Event>> voice : inst.getValue().entrySet()) {
				voices.put(voice.getKey(), Collections.unmodifiableList(new ArrayList<Event>(voice.getValue())));
			}
			copy.put(inst.getKey(), Collections.unmodifiableMap(voices));
		}
		this.instruments = Collections.unmodifiableMap(copy);
	}
	
	public List<String> instrumentNames() {
		return new ArrayList<String>(instruments.keySet());
	}
	
	public Map<String,List<Event>> voices(String instrument) {
		Map<String,List<Event>> voices = instruments.get(instrument);
		return voices == null ? Collections.<String,List<Event>>emptyMap() : voices;
	}
	
	public Optional<List<Event>> voice(String instrument, String voiceId) {
		return Optional.ofNullable(voices(instrument).get(voiceId));
	}
	
	public String toString() {
		return "ParsedScore(" + source + ", " + info + ", " + instruments.keySet() + ")";
	}

}
