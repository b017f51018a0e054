package samlverifier.parser;

import net.shibboleth.utilities.java.support.xml.ElementSupport;
import org.apache.commons.lang3.StringUtils;
import org.opensaml.core.xml.XMLObject;
import org.opensaml.core.xml.schema.XSAny;
import org.opensaml.core.xml.schema.XSString;
import org.opensaml.core.xml.schema.XSURI;
import org.opensaml.saml.saml2.core.*;
import org.opensaml.xmlsec.signature.Signature;
import org.w3c.dom.Element;
import samlverifier.SAMLException;
import samlverifier.model.*;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.opensaml.xmlsec.signature.support.SignatureConstants.XMLSIG_NS;
import static samlverifier.model.SAMLError.PARSE_ERROR;
import static samlverifier.parser.XMLObjectValidator.*;

/**
 * Reads a SAML 2.0 protocol Response into a {@link SAMLResponse}. Only the enveloped signature directly under the
 * Response is read, a signature on the Assertion is ignored. Every single valued element the verification depends on
 * must occur exactly once.
 */
public class SAMLResponseParser {

    private static final QName SIGNATURE_VALUE = new QName(XMLSIG_NS, "SignatureValue");

    private final SAMLDocumentParser documentParser;

    public SAMLResponseParser(SAMLDocumentParser documentParser) {
        this.documentParser = documentParser;
    }

    public SAMLResponse parse(byte[] xml) throws SAMLException {
        Response response = documentParser.parse(xml, Response.class);
        requireAtMostOne(response, Signature.DEFAULT_ELEMENT_NAME);
        if (response.getAssertions().size() != 1) {
            throw new SAMLException(PARSE_ERROR,
                    String.format("Response should have a single assertion, found %d", response.getAssertions().size()));
        }
        return new SAMLResponse(signature(response), assertion(response.getAssertions().get(0)));
    }

    private SAMLSignature signature(Response response) {
        Element signature = firstChild(response, Signature.DEFAULT_ELEMENT_NAME);
        if (signature == null) {
            return new SAMLSignature(null);
        }
        Element signatureValue = ElementSupport.getFirstChildElement(signature, SIGNATURE_VALUE);
        return new SAMLSignature(signatureValue == null ? null : StringUtils.trimToNull(signatureValue.getTextContent()));
    }

    private SAMLAssertion assertion(Assertion assertion) throws SAMLException {
        requireOne(assertion, Issuer.DEFAULT_ELEMENT_NAME);
        requireOne(assertion, Subject.DEFAULT_ELEMENT_NAME);
        requireOne(assertion, Conditions.DEFAULT_ELEMENT_NAME);

        List<SAMLAttribute> attributes = new ArrayList<>();
        for (AttributeStatement attributeStatement : assertion.getAttributeStatements()) {
            for (Attribute attribute : attributeStatement.getAttributes()) {
                attributes.add(attribute(attribute));
            }
        }
        return new SAMLAssertion(
                assertion.getIssuer().getValue(),
                subject(assertion.getSubject()),
                conditions(assertion.getConditions()),
                Collections.unmodifiableList(attributes));
    }

    private SAMLSubject subject(Subject subject) throws SAMLException {
        requireOne(subject, NameID.DEFAULT_ELEMENT_NAME);
        requireOne(subject, SubjectConfirmation.DEFAULT_ELEMENT_NAME);

        NameID nameID = subject.getNameID();
        SubjectConfirmation subjectConfirmation = subject.getSubjectConfirmations().get(0);
        requireOne(subjectConfirmation, SubjectConfirmationData.DEFAULT_ELEMENT_NAME);

        SubjectConfirmationData subjectConfirmationData = subjectConfirmation.getSubjectConfirmationData();
        requireAttribute(subjectConfirmationData, SubjectConfirmationData.RECIPIENT_ATTRIB_NAME);
        requireAttribute(subjectConfirmationData, SubjectConfirmationData.NOT_ON_OR_AFTER_ATTRIB_NAME);
        requireTimeZone(subjectConfirmationData, SubjectConfirmationData.NOT_ON_OR_AFTER_ATTRIB_NAME);

        return new SAMLSubject(
                new SAMLNameID(nameID.getFormat(), StringUtils.defaultString(nameID.getValue())),
                new SAMLSubjectConfirmation(subjectConfirmation.getMethod(),
                        new SAMLSubjectConfirmationData(subjectConfirmationData.getRecipient(), subjectConfirmationData.getNotOnOrAfter())));
    }

    private SAMLConditions conditions(Conditions conditions) throws SAMLException {
        requireAttribute(conditions, Conditions.NOT_ON_OR_AFTER_ATTRIB_NAME);
        requireTimeZone(conditions, Conditions.NOT_BEFORE_ATTRIB_NAME);
        requireTimeZone(conditions, Conditions.NOT_ON_OR_AFTER_ATTRIB_NAME);
        return new SAMLConditions(conditions.getNotBefore(), conditions.getNotOnOrAfter());
    }

    private SAMLAttribute attribute(Attribute attribute) throws SAMLException {
        requireAttribute(attribute, "Name");
        List<String> values = attribute.getAttributeValues().stream()
                .map(this::attributeValue)
                .collect(Collectors.toUnmodifiableList());
        return new SAMLAttribute(attribute.getName(), attribute.getNameFormat(), values);
    }

    private String attributeValue(XMLObject attributeValue) {
        if (attributeValue instanceof XSString) {
            return StringUtils.defaultString(((XSString) attributeValue).getValue());
        }
        if (attributeValue instanceof XSAny) {
            return StringUtils.defaultString(((XSAny) attributeValue).getTextContent());
        }
        if (attributeValue instanceof XSURI) {
            return StringUtils.defaultString(((XSURI) attributeValue).getURI());
        }
        //Other xsi:types, e.g. xs:integer or xs:boolean
        return StringUtils.trimToEmpty(attributeValue.getDOM().getTextContent());
    }
}
