package samlverifier.crypto;

import net.shibboleth.utilities.java.support.xml.XMLParserException;
import org.opensaml.core.xml.XMLObject;
import org.opensaml.core.xml.io.UnmarshallingException;
import org.opensaml.saml.common.SignableSAMLObject;
import org.opensaml.saml.security.impl.SAMLSignatureProfileValidator;
import org.opensaml.security.x509.BasicX509Credential;
import org.opensaml.xmlsec.signature.Signature;
import org.opensaml.xmlsec.signature.support.SignatureException;
import org.opensaml.xmlsec.signature.support.SignatureValidator;
import samlverifier.parser.SAMLDocumentParser;

import java.security.cert.X509Certificate;

/**
 * {@link SignatureVerifier} backed by OpenSAML. The document is unmarshalled again from the received bytes with its
 * DOM cached, so the signature is checked against the original document. The SAML signature profile is enforced: the
 * signature must reference its parent element and use the enveloped transform.
 */
public class OpenSamlSignatureVerifier implements SignatureVerifier {

    private final SAMLDocumentParser documentParser;
    private final SAMLSignatureProfileValidator profileValidator = new SAMLSignatureProfileValidator();

    public OpenSamlSignatureVerifier(SAMLDocumentParser documentParser) {
        this.documentParser = documentParser;
    }

    @Override
    public void verify(X509Certificate certificate, byte[] document) throws SignatureException {
        SignableSAMLObject signableObject = unmarshall(document);
        Signature signature = signableObject.getSignature();
        if (signature == null) {
            throw new SignatureException("Signature element not found.");
        }
        profileValidator.validate(signature);
        SignatureValidator.validate(signature, new BasicX509Credential(certificate));
    }

    private SignableSAMLObject unmarshall(byte[] document) throws SignatureException {
        XMLObject xmlObject;
        try {
            xmlObject = documentParser.unmarshall(document);
        } catch (XMLParserException | UnmarshallingException | IllegalArgumentException e) {
            throw new SignatureException("Unable to read signed document", e);
        }
        if (!(xmlObject instanceof SignableSAMLObject)) {
            throw new SignatureException("Element " + xmlObject.getElementQName() + " can not carry a signature");
        }
        return (SignableSAMLObject) xmlObject;
    }
}
