package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLKeyDescriptor {

    public static final String USE_SIGNING = "signing";
    public static final String USE_ENCRYPTION = "encryption";

    private final String use;
    /**
     * base64 encoded DER of the X.509 certificate
     */
    private final String certificate;

    public boolean isSigning() {
        return use == null || USE_SIGNING.equals(use);
    }

}
