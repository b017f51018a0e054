package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@AllArgsConstructor
@Getter
public class SAMLAttribute {

    private final String name;
    private final String nameFormat;
    private final List<String> values;

    /**
     * @return the first AttributeValue or null if the attribute has no values
     */
    public String getValue() {
        return values.isEmpty() ? null : values.get(0);
    }

}
