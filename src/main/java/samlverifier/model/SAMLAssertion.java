package samlverifier.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@AllArgsConstructor
public class SAMLAssertion {

    private final String issuer;
    private final SAMLSubject subject;
    private final SAMLConditions conditions;
    private final List<SAMLAttribute> attributes;

    /**
     * Collect the values of all attributes with the given name, in document order
     *
     * @param name the Name of the attribute
     * @return all values, empty if there is no such attribute
     */
    public List<String> getAttributeValues(String name) {
        return attributes.stream()
                .filter(attribute -> attribute.getName().equals(name))
                .flatMap(attribute -> attribute.getValues().stream())
                .collect(Collectors.toList());
    }

}
