package samlverifier;

import samlverifier.model.SAMLEntityDescriptor;
import samlverifier.model.SAMLIdentityProvider;
import samlverifier.model.SAMLResponse;

import java.net.URI;
import java.security.cert.X509Certificate;
import java.time.Instant;

public interface SAMLService {

    /**
     * Name of the HTTP POST parameter carrying the base64 encoded SAML response
     */
    String SAML_RESPONSE = "SAMLResponse";

    /**
     * Name of the query parameter on the redirect to the IdP and of the HTTP POST parameter on the way back
     */
    String RELAY_STATE = "RelayState";

    String HTTP_REDIRECT_BINDING = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Redirect";

    /**
     * Decode, parse and verify a {@link SAMLResponse}. The signature of the Response element is verified before any
     * of its content is looked at. Only responses signed as a whole are accepted, a signature on the Assertion alone
     * is ignored.
     *
     * @param samlResponse the base64 encoded value of the {@link #SAML_RESPONSE} parameter
     * @param issuer       the expected issuer of the Assertion
     * @param certificate  the certificate the issuer signs with. Its validity period is not checked
     * @param recipient    the expected Recipient of the SubjectConfirmationData, e.g. the ACS location
     * @param now          the current time, used to check the validity window of the Assertion
     * @return the verified {@link SAMLResponse}
     * @throws SAMLException with the {@link samlverifier.model.SAMLError} describing why the response is rejected
     */
    SAMLResponse verify(String samlResponse, String issuer, X509Certificate certificate, String recipient, Instant now) throws SAMLException;

    /**
     * Verify a {@link SAMLResponse} with a previously extracted {@link SAMLIdentityProvider}
     *
     * @see #verify(String, String, X509Certificate, String, Instant)
     */
    SAMLResponse verify(String samlResponse, SAMLIdentityProvider identityProvider, String recipient, Instant now) throws SAMLException;

    /**
     * Parse the XML metadata of an IdP
     *
     * @param xml the EntityDescriptor XML
     * @return the parsed {@link SAMLEntityDescriptor}
     * @throws SAMLException if the XML is malformed or misses required elements
     */
    SAMLEntityDescriptor parseMetaData(String xml) throws SAMLException;

    /**
     * Extract the entityID, the signing certificate and the first HTTP-Redirect SingleSignOnService location
     *
     * @param entityDescriptor the parsed IdP metadata
     * @return the {@link SAMLIdentityProvider} to store and use for all future verifications
     * @throws SAMLException if the certificate is malformed or there is no HTTP-Redirect binding
     */
    SAMLIdentityProvider extractTrustAnchor(SAMLEntityDescriptor entityDescriptor) throws SAMLException;

    /**
     * Parse the XML metadata and extract the {@link SAMLIdentityProvider}
     *
     * @see #parseMetaData(String)
     * @see #extractTrustAnchor(SAMLEntityDescriptor)
     */
    SAMLIdentityProvider resolveIdentityProvider(String xml) throws SAMLException;

    /**
     * The location to redirect the user to for logging in at the IdP
     *
     * @param identityProvider the IdP
     * @param relayState       optional opaque value the IdP returns unmodified in the {@link #RELAY_STATE} parameter
     * @return the redirect URL of the IdP with the relayState added as query parameter
     */
    URI redirectLocation(SAMLIdentityProvider identityProvider, String relayState);
}
