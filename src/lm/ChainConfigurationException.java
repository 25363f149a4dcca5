package lm;

/**
 * Thrown when a chain cannot be built from the requested voices and order.
 */
public class ChainConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ChainConfigurationException(String message) {
        super(message);
    }

}
