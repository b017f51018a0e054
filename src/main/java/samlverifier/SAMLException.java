package samlverifier;

import lombok.Getter;
import samlverifier.model.SAMLError;

/**
 * Thrown when a response or IdP metadata can not be trusted. The {@link SAMLError} tells why; the message is
 * meant for operators and must not be shown to the end user.
 */
@Getter
public class SAMLException extends Exception {

    private static final long serialVersionUID = 1L;

    private final SAMLError error;

    public SAMLException(SAMLError error, String reason) {
        super(error.getDescription() + ": " + reason);
        this.error = error;
    }

    public SAMLException(SAMLError error, String reason, Throwable cause) {
        super(error.getDescription() + ": " + reason, cause);
        this.error = error;
    }
}
