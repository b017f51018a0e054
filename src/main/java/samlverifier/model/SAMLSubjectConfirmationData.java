package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class SAMLSubjectConfirmationData {

    private final String recipient;
    private final Instant notOnOrAfter;

}
