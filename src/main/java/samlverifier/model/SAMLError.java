package samlverifier.model;

import lombok.Getter;

@Getter
public enum SAMLError {

    DECODE_ERROR("Malformed base64 payload"),
    PARSE_ERROR("Malformed XML document"),
    RESPONSE_NOT_SIGNED("Response not signed"),
    SIGNATURE_INVALID("Invalid signature"),
    INVALID_ISSUER("Invalid issuer"),
    INVALID_RECIPIENT("Invalid recipient"),
    ASSERTION_EXPIRED("Assertion expired"),
    CERTIFICATE_PARSE_ERROR("Malformed certificate"),
    NO_REDIRECT_BINDING("No HTTP-Redirect binding in IdP metadata");

    private final String description;

    SAMLError(String description) {
        this.description = description;
    }
}
