package samlverifier.crypto;

import org.opensaml.xmlsec.signature.support.SignatureException;

import java.security.cert.X509Certificate;

/**
 * Verifies the enveloped XML signature of the document element.
 * <p>
 * Implementations get the document exactly as it was received and must verify against those bytes, never against
 * a re-serialized model. They must be thread-safe and must not hold on to the certificate or the document after
 * the call returns.
 */
public interface SignatureVerifier {

    /**
     * @param certificate the trusted certificate of the issuer
     * @param document    the XML document as received
     * @throws SignatureException if the document element is not signed by the key of the certificate
     */
    void verify(X509Certificate certificate, byte[] document) throws SignatureException;

}
