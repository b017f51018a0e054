package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLResponse {

    private final SAMLSignature signature;
    private final SAMLAssertion assertion;

    public String getNameID() {
        return assertion.getSubject().getNameID().getValue();
    }

}
