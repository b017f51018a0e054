package samlverifier.parser;

import org.opensaml.saml.saml2.metadata.EntityDescriptor;
import org.opensaml.saml.saml2.metadata.IDPSSODescriptor;
import org.opensaml.saml.saml2.metadata.KeyDescriptor;
import org.opensaml.saml.saml2.metadata.SingleSignOnService;
import org.opensaml.security.credential.UsageType;
import org.opensaml.xmlsec.signature.KeyInfo;
import org.opensaml.xmlsec.signature.X509Certificate;
import org.opensaml.xmlsec.signature.X509Data;
import samlverifier.SAMLException;
import samlverifier.model.SAMLEntityDescriptor;
import samlverifier.model.SAMLIDPSSODescriptor;
import samlverifier.model.SAMLKeyDescriptor;
import samlverifier.model.SAMLSingleSignOnService;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static samlverifier.parser.XMLObjectValidator.requireAttribute;
import static samlverifier.parser.XMLObjectValidator.requireOne;

/**
 * Reads the EntityDescriptor of an IdP into a {@link SAMLEntityDescriptor}
 */
public class MetaDataParser {

    private final SAMLDocumentParser documentParser;

    public MetaDataParser(SAMLDocumentParser documentParser) {
        this.documentParser = documentParser;
    }

    public SAMLEntityDescriptor parse(byte[] xml) throws SAMLException {
        EntityDescriptor entityDescriptor = documentParser.parse(xml, EntityDescriptor.class);
        requireAttribute(entityDescriptor, EntityDescriptor.ENTITY_ID_ATTRIB_NAME);
        requireOne(entityDescriptor, IDPSSODescriptor.DEFAULT_ELEMENT_NAME);

        IDPSSODescriptor idpSSODescriptor = (IDPSSODescriptor) entityDescriptor.getRoleDescriptors(IDPSSODescriptor.DEFAULT_ELEMENT_NAME).get(0);

        List<SAMLKeyDescriptor> keyDescriptors = new ArrayList<>();
        for (KeyDescriptor keyDescriptor : idpSSODescriptor.getKeyDescriptors()) {
            keyDescriptors.add(keyDescriptor(keyDescriptor));
        }
        List<SAMLSingleSignOnService> singleSignOnServices = new ArrayList<>();
        for (SingleSignOnService singleSignOnService : idpSSODescriptor.getSingleSignOnServices()) {
            requireAttribute(singleSignOnService, SingleSignOnService.BINDING_ATTRIB_NAME);
            requireAttribute(singleSignOnService, SingleSignOnService.LOCATION_ATTRIB_NAME);
            singleSignOnServices.add(new SAMLSingleSignOnService(singleSignOnService.getBinding(), singleSignOnService.getLocation()));
        }
        return new SAMLEntityDescriptor(entityDescriptor.getEntityID(), new SAMLIDPSSODescriptor(
                Collections.unmodifiableList(keyDescriptors),
                Collections.unmodifiableList(singleSignOnServices)));
    }

    private SAMLKeyDescriptor keyDescriptor(KeyDescriptor keyDescriptor) throws SAMLException {
        requireOne(keyDescriptor, KeyInfo.DEFAULT_ELEMENT_NAME);
        KeyInfo keyInfo = keyDescriptor.getKeyInfo();
        requireOne(keyInfo, X509Data.DEFAULT_ELEMENT_NAME);
        X509Data x509Data = keyInfo.getX509Datas().get(0);
        requireOne(x509Data, X509Certificate.DEFAULT_ELEMENT_NAME);
        X509Certificate certificate = x509Data.getX509Certificates().get(0);

        String use = keyDescriptor.getUse() == UsageType.SIGNING ? SAMLKeyDescriptor.USE_SIGNING :
                keyDescriptor.getUse() == UsageType.ENCRYPTION ? SAMLKeyDescriptor.USE_ENCRYPTION : null;
        return new SAMLKeyDescriptor(use, certificate.getValue() == null ? "" : certificate.getValue());
    }
}
