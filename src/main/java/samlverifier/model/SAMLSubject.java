package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLSubject {

    private final SAMLNameID nameID;
    private final SAMLSubjectConfirmation subjectConfirmation;

}
