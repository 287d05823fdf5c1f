package gov.nih.nlm.sbgn;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads SBGN-ML documents into namespace aware DOM trees, and selects child
 * elements by SBGN element name and glyph class.
 */
public class SbgnXmlReader {

	/**
	 * Namespace prefix shared by all libSBGN releases
	 */
	public static final String SBGN_NS_PREFIX = "http://sbgn.org/libsbgn/";
	public static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
	public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

	/**
	 * Parse the specified file, and normalize.
	 *
	 * @param xmlFile File containing SBGN-ML to parse
	 * @return Document resulting after parsing, and normalization
	 */
	public static Document parseXmlFile(File xmlFile) {
		Document doc;
		try {
			doc = newDocumentBuilder().parse(xmlFile);
		} catch (SAXException | IOException e) {
			throw new RuntimeException(e);
		}
		doc.getDocumentElement().normalize();
		return doc;
	}

	/**
	 * Parse the specified string, and normalize.
	 *
	 * @param xml String containing SBGN-ML to parse
	 * @return Document resulting after parsing, and normalization
	 */
	public static Document parseXmlString(String xml) {
		Document doc;
		try {
			doc = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
		} catch (SAXException | IOException e) {
			throw new RuntimeException(e);
		}
		doc.getDocumentElement().normalize();
		return doc;
	}

	private static DocumentBuilder newDocumentBuilder() {
		DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
		dbFactory.setNamespaceAware(true);
		try {
			return dbFactory.newDocumentBuilder();
		} catch (ParserConfigurationException e) {
			throw new RuntimeException(e);
		}
	}

	/**
	 * Test if a node is an element in one of the libSBGN namespaces with the
	 * specified local name.
	 *
	 * @param node      Node to test
	 * @param localName Expected local name
	 * @return True if the node is a matching SBGN element
	 */
	public static boolean isSbgnElement(Node node, String localName) {
		if (node.getNodeType() != Node.ELEMENT_NODE) {
			return false;
		}
		String namespace = node.getNamespaceURI();
		return namespace != null && namespace.startsWith(SBGN_NS_PREFIX) && localName.equals(node.getLocalName());
	}

	/**
	 * Collect the direct child elements of a parent with the specified SBGN local
	 * name, in document order.
	 *
	 * @param parent    Parent element
	 * @param localName Local name of the children to collect
	 * @return Matching children
	 */
	public static List<Element> getSbgnChildren(Element parent, String localName) {
		List<Element> children = new ArrayList<>();
		NodeList nodeList = parent.getChildNodes();
		for (int i = 0; i < nodeList.getLength(); i++) {
			Node node = nodeList.item(i);
			if (isSbgnElement(node, localName)) {
				children.add((Element) node);
			}
		}
		return children;
	}

	/**
	 * Collect the direct child glyphs of a parent with the specified class.
	 *
	 * @param parent     Parent element
	 * @param glyphClass Value of the "class" attribute to match
	 * @return Matching glyphs
	 */
	public static List<Element> getChildGlyphs(Element parent, String glyphClass) {
		List<Element> glyphs = new ArrayList<>();
		for (Element glyph : getSbgnChildren(parent, "glyph")) {
			if (glyphClass.equals(glyph.getAttribute("class"))) {
				glyphs.add(glyph);
			}
		}
		return glyphs;
	}

	/**
	 * Collect the direct child elements of a parent in a namespace with the
	 * specified local name.
	 *
	 * @param parent    Parent element
	 * @param namespace Namespace URI of the children
	 * @param localName Local name of the children
	 * @return Matching children
	 */
	public static List<Element> getChildren(Element parent, String namespace, String localName) {
		List<Element> children = new ArrayList<>();
		NodeList nodeList = parent.getChildNodes();
		for (int i = 0; i < nodeList.getLength(); i++) {
			Node node = nodeList.item(i);
			if (node.getNodeType() == Node.ELEMENT_NODE && namespace.equals(node.getNamespaceURI())
					&& localName.equals(node.getLocalName())) {
				children.add((Element) node);
			}
		}
		return children;
	}

	/**
	 * Get an attribute value, treating an empty value as absent.
	 *
	 * @param element Element holding the attribute
	 * @param name    Attribute name
	 * @return Attribute value, or null if absent or empty
	 */
	public static String getAttributeOrNull(Element element, String name) {
		String value = element.getAttribute(name);
		return value.isEmpty() ? null : value;
	}
}
