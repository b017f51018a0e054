package samlverifier.parser;

import net.shibboleth.utilities.java.support.xml.ElementSupport;
import org.opensaml.core.xml.XMLObject;
import org.w3c.dom.Element;
import samlverifier.SAMLException;

import javax.xml.namespace.QName;
import java.util.regex.Pattern;

import static samlverifier.model.SAMLError.PARSE_ERROR;

/**
 * Checks on unmarshalled objects that OpenSAML does not make. Unmarshallers keep only the last occurrence of a single
 * valued child, so cardinality is counted on the cached DOM.
 */
final class XMLObjectValidator {

    private static final Pattern TIME_ZONE = Pattern.compile(".*(Z|[+-]\\d{2}:\\d{2})$");

    private XMLObjectValidator() {
    }

    static void requireOne(XMLObject parent, QName child) throws SAMLException {
        int count = count(parent, child);
        if (count != 1) {
            throw new SAMLException(PARSE_ERROR, String.format("Expected exactly one %s in %s, found %d",
                    child.getLocalPart(), parent.getElementQName().getLocalPart(), count));
        }
    }

    static void requireAtMostOne(XMLObject parent, QName child) throws SAMLException {
        int count = count(parent, child);
        if (count > 1) {
            throw new SAMLException(PARSE_ERROR, String.format("Expected at most one %s in %s, found %d",
                    child.getLocalPart(), parent.getElementQName().getLocalPart(), count));
        }
    }

    static void requireAttribute(XMLObject xmlObject, String attributeName) throws SAMLException {
        if (!dom(xmlObject).hasAttributeNS(null, attributeName)) {
            throw new SAMLException(PARSE_ERROR, String.format("Missing attribute %s on %s",
                    attributeName, xmlObject.getElementQName().getLocalPart()));
        }
    }

    /**
     * An xs:dateTime without time zone is read in the default time zone of the JVM, so it is refused
     */
    static void requireTimeZone(XMLObject xmlObject, String attributeName) throws SAMLException {
        Element element = dom(xmlObject);
        if (element.hasAttributeNS(null, attributeName)
                && !TIME_ZONE.matcher(element.getAttributeNS(null, attributeName).trim()).matches()) {
            throw new SAMLException(PARSE_ERROR, String.format("Attribute %s on %s has no time zone: %s",
                    attributeName, xmlObject.getElementQName().getLocalPart(), element.getAttributeNS(null, attributeName)));
        }
    }

    static Element firstChild(XMLObject parent, QName child) {
        return ElementSupport.getFirstChildElement(dom(parent), child);
    }

    private static int count(XMLObject parent, QName child) {
        return ElementSupport.getChildElements(dom(parent), child).size();
    }

    private static Element dom(XMLObject xmlObject) {
        Element element = xmlObject.getDOM();
        if (element == null) {
            throw new IllegalStateException("No cached DOM for " + xmlObject.getElementQName());
        }
        return element;
    }
}
