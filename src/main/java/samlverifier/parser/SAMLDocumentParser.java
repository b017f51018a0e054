package samlverifier.parser;

import lombok.SneakyThrows;
import net.shibboleth.utilities.java.support.xml.ParserPool;
import net.shibboleth.utilities.java.support.xml.XMLParserException;
import org.opensaml.core.config.InitializationService;
import org.opensaml.core.xml.XMLObject;
import org.opensaml.core.xml.io.Unmarshaller;
import org.opensaml.core.xml.io.UnmarshallingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import samlverifier.SAMLException;

import java.io.ByteArrayInputStream;

import static org.opensaml.core.xml.config.XMLObjectProviderRegistrySupport.getUnmarshallerFactory;
import static samlverifier.model.SAMLError.PARSE_ERROR;

/**
 * Parses XML with the shared parser pool and unmarshalls the document element into the OpenSAML object model. The
 * unmarshalled objects keep their DOM, which is used for the cardinality checks in {@link XMLObjectValidator}.
 */
public class SAMLDocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(SAMLDocumentParser.class);

    private static boolean initialized = false;

    private final ParserPool parserPool;

    public SAMLDocumentParser(ParserPool parserPool) {
        bootstrap();
        this.parserPool = parserPool;
    }

    /**
     * Initialize the OpenSAML object providers once per JVM. Must be done before any unmarshalling.
     */
    @SneakyThrows
    public static synchronized void bootstrap() {
        if (!initialized) {
            InitializationService.initialize();
            initialized = true;
            LOG.debug("OpenSAML initialized");
        }
    }

    public XMLObject unmarshall(byte[] xml) throws XMLParserException, UnmarshallingException {
        Document document = parserPool.parse(new ByteArrayInputStream(xml));
        Element element = document.getDocumentElement();
        Unmarshaller unmarshaller = getUnmarshallerFactory().getUnmarshaller(element);
        if (unmarshaller == null) {
            throw new UnmarshallingException(String.format("No unmarshaller for element {%s}%s",
                    element.getNamespaceURI(), element.getLocalName()));
        }
        return unmarshaller.unmarshall(element);
    }

    /**
     * Parse the XML and unmarshall the document element
     *
     * @param xml  the raw XML bytes
     * @param type the expected type of the document element, e.g. {@link org.opensaml.saml.saml2.core.Response}
     * @return the unmarshalled document element
     * @throws SAMLException with {@link samlverifier.model.SAMLError#PARSE_ERROR} for malformed XML, invalid attribute
     *                       values or a document element of another type
     */
    public <T extends XMLObject> T parse(byte[] xml, Class<T> type) throws SAMLException {
        XMLObject xmlObject;
        try {
            xmlObject = unmarshall(xml);
        } catch (XMLParserException | UnmarshallingException e) {
            throw new SAMLException(PARSE_ERROR, "Unable to parse XML: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            //Unmarshallers reject malformed xs:dateTime and enumeration values this way
            throw new SAMLException(PARSE_ERROR, "Invalid attribute value: " + e.getMessage(), e);
        }
        if (!type.isInstance(xmlObject)) {
            throw new SAMLException(PARSE_ERROR,
                    String.format("Expected %s, found %s", type.getSimpleName(), xmlObject.getElementQName()));
        }
        return type.cast(xmlObject);
    }
}
