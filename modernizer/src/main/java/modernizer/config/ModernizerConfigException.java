package modernizer.config;

/**
 * Exception thrown when modernizer configuration cannot be loaded or is invalid.
 *
 * <p>This is an unchecked exception so that configuration loading can sit in
 * initialization code without forced exception handling.
 *
 * @see ModernizerConfigLoader
 */
public class ModernizerConfigException extends RuntimeException {

    public ModernizerConfigException(String message) {
        super(message);
    }

    public ModernizerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
