package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

@Getter
@AllArgsConstructor
public class SAMLSignature {

    private final String signatureValue;

    public boolean isEmpty() {
        return StringUtils.isBlank(signatureValue);
    }

}
