package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLEntityDescriptor {

    private final String entityID;
    private final SAMLIDPSSODescriptor idpSSODescriptor;

}
