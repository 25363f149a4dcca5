package score;

/**
 * Thrown when a note or event string does not follow the codec grammar.
 */
public class EventFormatException extends IllegalArgumentException {
	
	private static final long serialVersionUID = 1L;
	
	public EventFormatException(String message) {
		super(message);
	}
	
	public EventFormatException(String message, Throwable cause) {
		super(message, cause);
	}

}
