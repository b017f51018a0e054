package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.net.URI;
import java.security.cert.X509Certificate;

/**
 * Everything needed to verify responses of one IdP. Meant to be stored by the caller and re-used for every login.
 */
@Getter
@AllArgsConstructor
public class SAMLIdentityProvider {

    private final String entityId;
    private final X509Certificate certificate;
    private final URI redirectURL;

}
