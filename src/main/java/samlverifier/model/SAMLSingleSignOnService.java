package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SAMLSingleSignOnService {

    private final String binding;
    private final String location;

}
