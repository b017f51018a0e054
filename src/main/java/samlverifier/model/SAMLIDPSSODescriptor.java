package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

@Getter
@AllArgsConstructor
public class SAMLIDPSSODescriptor {

    private final List<SAMLKeyDescriptor> keyDescriptors;
    private final List<SAMLSingleSignOnService> singleSignOnServices;

    public Optional<SAMLKeyDescriptor> getSigningKeyDescriptor() {
        return keyDescriptors.stream().filter(SAMLKeyDescriptor::isSigning).findFirst();
    }

}
