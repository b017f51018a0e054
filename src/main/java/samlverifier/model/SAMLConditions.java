package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class SAMLConditions {

    /**
     * May be null, in which case the assertion has no lower bound
     */
    private final Instant notBefore;
    private final Instant notOnOrAfter;

}
