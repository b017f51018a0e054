package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLSubjectConfirmation {

    private final String method;
    private final SAMLSubjectConfirmationData subjectConfirmationData;

}
