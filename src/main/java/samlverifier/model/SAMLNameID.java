package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The identifier the IdP chose for the subject. Only unique in combination with the issuer.
 */
@Getter
@AllArgsConstructor
public class SAMLNameID {

    private final String format;
    private final String value;

}
