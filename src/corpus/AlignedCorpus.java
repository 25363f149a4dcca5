package corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import score.Event;

/**
 * Per-voice event sequences merged across scores. Time step {@code i} is
 * the i-th event of every voice; only the first {@link #minVoiceLength()}
 * steps are aligned.
 */
public class AlignedCorpus {
	
	public final List<String> voiceIds;
	public final List<List<Event>> voices;
	public final ScoreInfo info;
	
	public AlignedCorpus(List<String> voiceIds, List<List<Event>> voices, ScoreInfo info) {
		if (voiceIds.size() != voices.size()) {
			throw new IllegalArgumentException("Got "+voiceIds.size()+" voice ids for "+voices.size()+" voices");
		}
		List<List<Event>> copy = new ArrayList<List<Event>>();
		for (List<Event> voice : voices) {
			copy.add(Collections.unmodifiableList(new ArrayList<Event>(voice)));
		}
		this.voiceIds = Collections.unmodifiableList(new ArrayList<String>(voiceIds));
		this.voices = Collections.unmodifiableList(copy);
		this.info = info;
	}
	
	/**
	 * Voices named by their position, 1-based.
	 */
	public static AlignedCorpus of(List<List<Event>> voices) {
		List<String> ids = new ArrayList<String>();
		for (int v=0; v<voices.size(); ++v) ids.add(Integer.toString(v+1));
		return new AlignedCorpus(ids, voices, null);
	}
	
	public int numVoices() {
		return voices.size();
	}
	
	public int minVoiceLength() {
		if (voices.isEmpty()) return 0;
		int min = Integer.MAX_VALUE;
		for (List<Event> voice : voices) min = Math.min(min, voice.size());
		return min;
	}
	
	/**
	 * Events of all voices at step {@code t}, in voice order.
	 */
	public List<Event> eventsAt(int t) {
		List<Event> events = new ArrayList<Event>(voices.size());
		for (List<Event> voice : voices) events.add(voice.get(t));
		return events;
	}

}
