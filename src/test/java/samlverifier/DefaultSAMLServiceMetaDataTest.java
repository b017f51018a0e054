package samlverifier;

import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import samlverifier.crypto.X509Utilities;
import samlverifier.model.SAMLEntityDescriptor;
import samlverifier.model.SAMLError;
import samlverifier.model.SAMLIdentityProvider;
import samlverifier.model.SAMLSingleSignOnService;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSAMLServiceMetaDataTest {

    private static final String ENTITY_ID = "https://idp.example/metadata";
    private static final String POST = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-POST";
    private static final String ARTIFACT = "urn:oasis:names:tc:SAML:2.0:bindings:HTTP-Artifact";

    private final DefaultSAMLService samlService = new DefaultSAMLService();

    private static String certificate(String name) {
        return SAMLResponseFactory.readFile(name + ".crt")
                .replace(X509Utilities.BEGIN_CERT, "")
                .replace(X509Utilities.END_CERT, "")
                .trim();
    }

    private static String keyDescriptor(String use, String certificate) {
        return String.format("<md:KeyDescriptor%s><ds:KeyInfo><ds:X509Data><ds:X509Certificate>%s</ds:X509Certificate></ds:X509Data></ds:KeyInfo></md:KeyDescriptor>",
                use == null ? "" : " use=\"" + use + "\"", certificate);
    }

    private static String singleSignOnService(String binding, String location) {
        return String.format("<md:SingleSignOnService Binding=\"%s\" Location=\"%s\"/>", binding, location);
    }

    private static String metaData(String keyDescriptors, String... singleSignOnServices) {
        return String.format(SAMLResponseFactory.readFile("idp_metadata.xml"),
                ENTITY_ID, keyDescriptors, String.join("\n", singleSignOnServices));
    }

    private static void assertRejected(SAMLError expected, String metaData) {
        SAMLException e = assertThrows(SAMLException.class, () -> new DefaultSAMLService().resolveIdentityProvider(metaData));
        assertEquals(expected, e.getError(), e.getMessage());
    }

    @SneakyThrows
    @Test
    void resolveIdentityProvider() {
        String metaData = metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso/redirect?tenant=1"),
                singleSignOnService(POST, "https://idp.example/sso/post"));

        SAMLIdentityProvider identityProvider = samlService.resolveIdentityProvider(metaData);

        assertEquals(ENTITY_ID, identityProvider.getEntityId());
        assertEquals(SAMLResponseFactory.certificate("saml_idp"), identityProvider.getCertificate());
        assertEquals(URI.create("https://idp.example/sso/redirect?tenant=1"), identityProvider.getRedirectURL());
    }

    @SneakyThrows
    @Test
    void parseMetaData() {
        String metaData = metaData(keyDescriptor("encryption", certificate("saml_rogue")) + keyDescriptor(null, certificate("saml_idp")),
                singleSignOnService(POST, "https://idp.example/sso/post"),
                singleSignOnService(ARTIFACT, "https://idp.example/sso/artifact"));

        SAMLEntityDescriptor entityDescriptor = samlService.parseMetaData(metaData);

        assertEquals(ENTITY_ID, entityDescriptor.getEntityID());
        assertEquals(2, entityDescriptor.getIdpSSODescriptor().getKeyDescriptors().size());
        assertEquals(List.of(POST, ARTIFACT), entityDescriptor.getIdpSSODescriptor().getSingleSignOnServices().stream()
                .map(SAMLSingleSignOnService::getBinding)
                .collect(Collectors.toList()));
    }

    @SneakyThrows
    @Test
    void signingKeyDescriptorPreferred() {
        String metaData = metaData(keyDescriptor("encryption", certificate("saml_rogue")) + keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso"));

        SAMLIdentityProvider identityProvider = samlService.resolveIdentityProvider(metaData);
        assertEquals(SAMLResponseFactory.certificate("saml_idp"), identityProvider.getCertificate());
    }

    @SneakyThrows
    @Test
    void redirectBindingAtAnyPosition() {
        String location = "https://idp.example/sso/redirect/last";
        String metaData = metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(POST, "https://idp.example/sso/post"),
                singleSignOnService(ARTIFACT, "https://idp.example/sso/artifact"),
                singleSignOnService("urn:oasis:names:tc:SAML:2.0:bindings:SOAP", "https://idp.example/sso/soap"),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, location));

        SAMLEntityDescriptor entityDescriptor = samlService.parseMetaData(metaData);
        SAMLIdentityProvider identityProvider = samlService.extractTrustAnchor(entityDescriptor);

        assertEquals(location, identityProvider.getRedirectURL().toString());
    }

    @SneakyThrows
    @Test
    void firstRedirectBindingWins() {
        String metaData = metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/first"),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/second"));

        assertEquals("https://idp.example/first", samlService.resolveIdentityProvider(metaData).getRedirectURL().toString());
    }

    @Test
    void noRedirectBinding() {
        assertRejected(SAMLError.NO_REDIRECT_BINDING, metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(POST, "https://idp.example/sso/post"),
                singleSignOnService(ARTIFACT, "https://idp.example/sso/artifact")));
        assertRejected(SAMLError.NO_REDIRECT_BINDING, metaData(keyDescriptor("signing", certificate("saml_idp"))));
    }

    @Test
    void malformedCertificateEncoding() {
        assertRejected(SAMLError.DECODE_ERROR, metaData(keyDescriptor("signing", "MIIC*not-base64*"),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void malformedCertificate() {
        assertRejected(SAMLError.CERTIFICATE_PARSE_ERROR, metaData(keyDescriptor("signing", "bm90IGEgY2VydGlmaWNhdGU="),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void noSigningCertificate() {
        assertRejected(SAMLError.CERTIFICATE_PARSE_ERROR, metaData(keyDescriptor("encryption", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void certificateCheckedBeforeBindings() {
        assertRejected(SAMLError.CERTIFICATE_PARSE_ERROR, metaData(keyDescriptor("signing", "bm90IGEgY2VydGlmaWNhdGU="),
                singleSignOnService(POST, "https://idp.example/sso/post")));
    }

    @Test
    void malformedRedirectLocation() {
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso redirect")));
    }

    @Test
    void opaqueRedirectLocation() {
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "urn:example:sso")));
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "/sso/redirect")));
    }

    @Test
    void twoCertificatesInKeyInfo() {
        String keyDescriptor = String.format("<md:KeyDescriptor use=\"signing\"><ds:KeyInfo>" +
                        "<ds:X509Data><ds:X509Certificate>%s</ds:X509Certificate></ds:X509Data>" +
                        "<ds:X509Data><ds:X509Certificate>%s</ds:X509Certificate></ds:X509Data>" +
                        "</ds:KeyInfo></md:KeyDescriptor>",
                certificate("saml_rogue"), certificate("saml_idp"));
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor,
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void keyDescriptorWithoutKeyInfo() {
        assertRejected(SAMLError.PARSE_ERROR, metaData("<md:KeyDescriptor use=\"signing\"/>",
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void unknownKeyUse() {
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor("verification", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso")));
    }

    @Test
    void twoIdentityProviderDescriptors() {
        String metaData = metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso"));
        int start = metaData.indexOf("<md:IDPSSODescriptor");
        int end = metaData.indexOf("</md:IDPSSODescriptor>") + "</md:IDPSSODescriptor>".length();
        assertRejected(SAMLError.PARSE_ERROR, metaData.substring(0, end) + metaData.substring(start, end) + metaData.substring(end));
    }

    @Test
    void missingBinding() {
        assertRejected(SAMLError.PARSE_ERROR, metaData(keyDescriptor("signing", certificate("saml_idp")),
                "<md:SingleSignOnService Location=\"https://idp.example/sso\"/>"));
    }

    @Test
    void responseInsteadOfMetaData() {
        assertRejected(SAMLError.PARSE_ERROR,
                "<samlp:Response xmlns:samlp=\"urn:oasis:names:tc:SAML:2.0:protocol\" ID=\"r\" Version=\"2.0\"/>");
    }

    @Test
    void missingEntityID() {
        String metaData = metaData(keyDescriptor("signing", certificate("saml_idp")),
                singleSignOnService(SAMLService.HTTP_REDIRECT_BINDING, "https://idp.example/sso"))
                .replace("entityID=\"" + ENTITY_ID + "\"", "");
        assertRejected(SAMLError.PARSE_ERROR, metaData);
    }

    @Test
    void doctypeRefused() {
        String metaData = "<?xml version=\"1.0\"?><!DOCTYPE foo [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>" +
                "<md:EntityDescriptor xmlns:md=\"urn:oasis:names:tc:SAML:2.0:metadata\" entityID=\"&xxe;\"/>";
        assertRejected(SAMLError.PARSE_ERROR, metaData);
    }

    @SneakyThrows
    @Test
    void redirectLocation() {
        SAMLIdentityProvider identityProvider = new SAMLIdentityProvider(ENTITY_ID, SAMLResponseFactory.certificate("saml_idp"),
                URI.create("https://idp.example/sso?tenant=a%2Fb&RelayState=old"));

        URI location = samlService.redirectLocation(identityProvider, "/todos?filter=open&page=2");

        assertEquals("https://idp.example/sso?tenant=a%2Fb&RelayState=%2Ftodos%3Ffilter%3Dopen%26page%3D2", location.toString());
        assertEquals("/todos?filter=open&page=2", location.getQuery().substring(location.getQuery().indexOf("RelayState=") + "RelayState=".length()));
    }

    @SneakyThrows
    @Test
    void redirectLocationWithoutRelayState() {
        URI redirectURL = URI.create("https://idp.example/sso");
        SAMLIdentityProvider identityProvider = new SAMLIdentityProvider(ENTITY_ID, SAMLResponseFactory.certificate("saml_idp"), redirectURL);

        assertEquals(redirectURL, samlService.redirectLocation(identityProvider, null));
        assertEquals("https://idp.example/sso?RelayState=abc", samlService.redirectLocation(identityProvider, "abc").toString());
    }

    @SneakyThrows
    @Test
    void redirectLocationWithFragment() {
        SAMLIdentityProvider identityProvider = new SAMLIdentityProvider(ENTITY_ID, SAMLResponseFactory.certificate("saml_idp"),
                URI.create("https://idp.example:8443/sso?RelayState=old&lang=nl#login"));

        URI location = samlService.redirectLocation(identityProvider, "new");

        assertEquals("https", location.getScheme());
        assertEquals("idp.example", location.getHost());
        assertEquals(8443, location.getPort());
        assertEquals("/sso", location.getPath());
        assertEquals("lang=nl&RelayState=new", location.getQuery());
        assertEquals("login", location.getFragment());
    }

    @Test
    void redirectLocationNotAURL() {
        SAMLIdentityProvider identityProvider = new SAMLIdentityProvider(ENTITY_ID, SAMLResponseFactory.certificate("saml_idp"),
                URI.create("urn:example:sso"));
        assertThrows(IllegalArgumentException.class, () -> samlService.redirectLocation(identityProvider, "abc"));
        assertEquals(URI.create("urn:example:sso"), samlService.redirectLocation(identityProvider, null));
    }
}
