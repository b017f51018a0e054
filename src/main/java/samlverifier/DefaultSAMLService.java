package samlverifier;

import net.shibboleth.utilities.java.support.collection.Pair;
import net.shibboleth.utilities.java.support.net.URLBuilder;
import org.apache.commons.lang3.StringUtils;
import org.opensaml.xmlsec.signature.support.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import samlverifier.crypto.OpenSamlSignatureVerifier;
import samlverifier.crypto.SignatureVerifier;
import samlverifier.crypto.X509Utilities;
import samlverifier.model.*;
import samlverifier.parser.EncodingUtils;
import samlverifier.parser.MetaDataParser;
import samlverifier.parser.ParserPoolFactory;
import samlverifier.parser.SAMLDocumentParser;
import samlverifier.parser.SAMLResponseParser;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;
import static samlverifier.model.SAMLError.*;

/**
 * Stateless apart from the thread-safe parser pool and {@link SignatureVerifier}, so one instance can serve all
 * threads.
 */
public class DefaultSAMLService implements SAMLService {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultSAMLService.class);

    private final SAMLResponseParser responseParser;
    private final MetaDataParser metaDataParser;
    private final SignatureVerifier signatureVerifier;

    public DefaultSAMLService() {
        this(new SAMLDocumentParser(ParserPoolFactory.createParserPool()));
    }

    public DefaultSAMLService(SignatureVerifier signatureVerifier) {
        this(new SAMLDocumentParser(ParserPoolFactory.createParserPool()), signatureVerifier);
    }

    private DefaultSAMLService(SAMLDocumentParser documentParser) {
        this(documentParser, new OpenSamlSignatureVerifier(documentParser));
    }

    private DefaultSAMLService(SAMLDocumentParser documentParser, SignatureVerifier signatureVerifier) {
        this.responseParser = new SAMLResponseParser(documentParser);
        this.metaDataParser = new MetaDataParser(documentParser);
        this.signatureVerifier = Objects.requireNonNull(signatureVerifier);
    }

    @Override
    public SAMLResponse verify(String samlResponse, String issuer, X509Certificate certificate, String recipient, Instant now) throws SAMLException {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(recipient, "recipient");
        Objects.requireNonNull(now, "now");
        try {
            SAMLResponse response = doVerify(samlResponse, issuer, certificate, recipient, now);
            LOG.debug("Verified SAML response of {} for NameID format {}", issuer,
                    response.getAssertion().getSubject().getNameID().getFormat());
            return response;
        } catch (SAMLException e) {
            LOG.debug("Rejected SAML response for expected issuer {}: {}", issuer, e.getMessage());
            throw e;
        }
    }

    @Override
    public SAMLResponse verify(String samlResponse, SAMLIdentityProvider identityProvider, String recipient, Instant now) throws SAMLException {
        return verify(samlResponse, identityProvider.getEntityId(), identityProvider.getCertificate(), recipient, now);
    }

    private SAMLResponse doVerify(String samlResponse, String issuer, X509Certificate certificate, String recipient, Instant now) throws SAMLException {
        byte[] xml = EncodingUtils.samlDecode(samlResponse);
        SAMLResponse response = responseParser.parse(xml);

        if (response.getSignature().isEmpty()) {
            throw new SAMLException(RESPONSE_NOT_SIGNED, "Response element has no signature value");
        }
        //The parsed model is not trusted yet; verification must use the bytes as received
        try {
            signatureVerifier.verify(certificate, xml);
        } catch (SignatureException e) {
            throw new SAMLException(SIGNATURE_INVALID, String.valueOf(e.getMessage()), e);
        }

        SAMLAssertion assertion = response.getAssertion();
        if (!issuer.equals(assertion.getIssuer())) {
            throw new SAMLException(INVALID_ISSUER, String.format("Expected %s, got %s", issuer, assertion.getIssuer()));
        }
        SAMLSubjectConfirmationData subjectConfirmationData = assertion.getSubject().getSubjectConfirmation().getSubjectConfirmationData();
        if (!recipient.equals(subjectConfirmationData.getRecipient())) {
            throw new SAMLException(INVALID_RECIPIENT, String.format("Expected %s, got %s", recipient, subjectConfirmationData.getRecipient()));
        }
        validateValidityWindow(assertion.getConditions(), subjectConfirmationData, now);
        return response;
    }

    private void validateValidityWindow(SAMLConditions conditions, SAMLSubjectConfirmationData subjectConfirmationData, Instant now) throws SAMLException {
        Instant notBefore = conditions.getNotBefore();
        if (notBefore != null && now.isBefore(notBefore)) {
            throw new SAMLException(ASSERTION_EXPIRED, String.format("Conditions not valid before %s, now is %s", notBefore, now));
        }
        if (!now.isBefore(conditions.getNotOnOrAfter())) {
            throw new SAMLException(ASSERTION_EXPIRED, String.format("Conditions not valid on or after %s, now is %s", conditions.getNotOnOrAfter(), now));
        }
        if (!now.isBefore(subjectConfirmationData.getNotOnOrAfter())) {
            throw new SAMLException(ASSERTION_EXPIRED, String.format("SubjectConfirmationData not valid on or after %s, now is %s", subjectConfirmationData.getNotOnOrAfter(), now));
        }
    }

    @Override
    public SAMLEntityDescriptor parseMetaData(String xml) throws SAMLException {
        Objects.requireNonNull(xml, "xml");
        return metaDataParser.parse(xml.getBytes(UTF_8));
    }

    @Override
    public SAMLIdentityProvider extractTrustAnchor(SAMLEntityDescriptor entityDescriptor) throws SAMLException {
        SAMLIDPSSODescriptor idpSSODescriptor = entityDescriptor.getIdpSSODescriptor();
        SAMLKeyDescriptor keyDescriptor = idpSSODescriptor.getSigningKeyDescriptor()
                .orElseThrow(() -> new SAMLException(CERTIFICATE_PARSE_ERROR, "No signing KeyDescriptor for " + entityDescriptor.getEntityID()));

        byte[] der = X509Utilities.getDER(keyDescriptor.getCertificate());
        X509Certificate certificate = X509Utilities.getCertificate(der);

        SAMLSingleSignOnService singleSignOnService = idpSSODescriptor.getSingleSignOnServices().stream()
                .filter(service -> HTTP_REDIRECT_BINDING.equals(service.getBinding()))
                .findFirst()
                .orElseThrow(() -> new SAMLException(NO_REDIRECT_BINDING, "No SingleSignOnService for " + entityDescriptor.getEntityID()));
        try {
            URI redirectURL = new URI(singleSignOnService.getLocation());
            if (!redirectURL.isAbsolute() || redirectURL.isOpaque()) {
                throw new SAMLException(PARSE_ERROR, "SingleSignOnService location is not an absolute URL: " + redirectURL);
            }
            return new SAMLIdentityProvider(entityDescriptor.getEntityID(), certificate, redirectURL);
        } catch (URISyntaxException e) {
            throw new SAMLException(PARSE_ERROR, "Invalid SingleSignOnService location " + singleSignOnService.getLocation(), e);
        }
    }

    @Override
    public SAMLIdentityProvider resolveIdentityProvider(String xml) throws SAMLException {
        SAMLIdentityProvider identityProvider = extractTrustAnchor(parseMetaData(xml));
        LOG.debug("Resolved IdP {} with redirect location {}", identityProvider.getEntityId(), identityProvider.getRedirectURL());
        return identityProvider;
    }

    @Override
    public URI redirectLocation(SAMLIdentityProvider identityProvider, String relayState) {
        URI redirectURL = identityProvider.getRedirectURL();
        if (StringUtils.isEmpty(relayState)) {
            return redirectURL;
        }
        try {
            URLBuilder urlBuilder = new URLBuilder(redirectURL.toString());
            List<Pair<String, String>> queryParams = urlBuilder.getQueryParams();
            queryParams.removeIf(queryParam -> RELAY_STATE.equals(queryParam.getFirst()));
            queryParams.add(new Pair<>(RELAY_STATE, relayState));
            return URI.create(urlBuilder.buildURL());
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Redirect URL of " + identityProvider.getEntityId() + " is not a URL: " + redirectURL, e);
        }
    }
}
