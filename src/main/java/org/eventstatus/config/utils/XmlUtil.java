package org.eventstatus.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.Unmarshaller;
import org.w3c.dom.Document;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;

public class XmlUtil {

    private XmlUtil() {}

    /**
     * Parses an XML stream into a DOM document with external entities disabled.
     */
    public static Document parse(InputStream in) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        return builder.parse(in);
    }

    /**
     * Converts a parsed XML document into an instance of {@code type}.
     * Callers must handle invalid XML.
     */
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return type.cast(um.unmarshal(xmlDoc));
    }
}
