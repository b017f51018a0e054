package samlverifier.crypto;


import samlverifier.SAMLException;
import samlverifier.parser.EncodingUtils;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

import static samlverifier.model.SAMLError.CERTIFICATE_PARSE_ERROR;

public class X509Utilities {

    public static final String BEGIN_CERT = "-----BEGIN CERTIFICATE-----";
    public static final String END_CERT = "-----END CERTIFICATE-----";

    private X509Utilities() {
    }

    /**
     * @param pem a PEM certificate or the bare base64 content of a ds:X509Certificate element
     * @return the DER bytes
     * @throws SAMLException with {@link samlverifier.model.SAMLError#DECODE_ERROR} if the content is not base64
     */
    public static byte[] getDER(String pem) throws SAMLException {
        return EncodingUtils.samlDecode(keyCleanup(pem));
    }

    private static String keyCleanup(String pem) {
        return pem
                .replace(BEGIN_CERT, "")
                .replace(END_CERT, "")
                .trim();
    }

    /**
     * Structural parse only, neither the validity period nor the chain is checked
     */
    public static X509Certificate getCertificate(byte[] der) throws SAMLException {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
        } catch (CertificateException e) {
            throw new SAMLException(CERTIFICATE_PARSE_ERROR, e.getMessage(), e);
        }
    }

    /**
     * Restore a certificate that was stored as PEM, e.g. the certificate of a persisted
     * {@link samlverifier.model.SAMLIdentityProvider}
     */
    public static X509Certificate getCertificate(String pem) throws SAMLException {
        return getCertificate(getDER(pem));
    }

}
