package corpus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import lm.ChainConfigurationException;
import score.Event;

/**
 * Concatenates the streams of the selected voices across a list of scores.
 */
public class CorpusAggregator {
	
	private static final Logger LOG = Logger.getLogger(CorpusAggregator.class.getName());
	
	public static AlignedCorpus aggregate(List<ParsedScore> scores, List<String> voiceIds) {
		if (voiceIds == null || voiceIds.isEmpty()) {
			throw new ChainConfigurationException("At least one voice must be selected");
		}
		if (scores == null || scores.isEmpty()) {
			throw new ChainConfigurationException("At least one score must be supplied");
		}
		
		List<List<Event>> voices = new ArrayList<List<Event>>();
		for (String voiceId : voiceIds) {
			List<Event> merged = new ArrayList<Event>();
			int numSupplying = 0;
			for (ParsedScore score : scores) {
				boolean found = false;
				for (String instrument : score.instrumentNames()) {
					Optional<List<Event>> stream = score.voice(instrument, voiceId);
					if (stream.isPresent()) {
						merged.addAll(stream.get());
						found = true;
					}
				}
				if (found) {
					numSupplying++;
				} else {
					LOG.warning("Voice "+voiceId+" not found in "+score.source+", skipping it for that score");
				}
			}
			if (numSupplying == 0) {
				throw new MissingVoiceException(voiceId);
			}
			voices.add(merged);
		}
		
		AlignedCorpus corpus = new AlignedCorpus(voiceIds, voices, scores.get(0).info);
		int minLength = corpus.minVoiceLength();
		for (int v=0; v<voices.size(); ++v) {
			int dropped = voices.get(v).size() - minLength;
			if (dropped > 0) {
				LOG.fine("Voice "+voiceIds.get(v)+" has "+dropped+" events beyond the aligned length "+minLength);
			}
		}
		return corpus;
	}

}
