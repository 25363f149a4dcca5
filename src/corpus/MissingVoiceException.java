package corpus;

/**
 * Thrown when a requested voice is not supplied by any score of the corpus.
 */
public class MissingVoiceException extends RuntimeException {
	
	private static final long serialVersionUID = 1L;
	
	public final String voiceId;
	
	public MissingVoiceException(String voiceId) {
		super("Voice not found in any score: "+voiceId);
		this.voiceId = voiceId;
	}

}
