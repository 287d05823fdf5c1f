package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.RDF_NS;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getSbgnChildren;
import static gov.nih.nlm.sbgn.SbgnXmlReader.isSbgnElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Extracts the label, and the cross-references embedded in the RDF annotation
 * of a glyph.
 */
public class LabelExtractor {

	private static final Logger LOGGER = LogManager.getLogger(LabelExtractor.class);

	// Assign patterns for matching MIRIAM URNs, and identifiers.org URLs
	private static final Pattern urnPattern = Pattern.compile("^urn:miriam:([^:]+):(.+)$");
	private static final Pattern identifiersPattern = Pattern
			.compile("^https?://identifiers\\.org/([^/:]+)[/:](.+)$");

	/**
	 * Get the text of the first label of a glyph.
	 *
	 * @param glyph Glyph element
	 * @return Label text, or an empty string if the glyph has no label
	 */
	public static String getLabel(Element glyph) {
		List<Element> labels = getSbgnChildren(glyph, "label");
		if (labels.isEmpty()) {
			return "";
		}
		return labels.get(0).getAttribute("text");
	}

	/**
	 * Collect the cross-references in the annotation of a glyph, ignoring the
	 * annotations of nested glyphs.
	 *
	 * @param glyph Glyph element
	 * @return References in document order
	 */
	public static List<Reference> getReferences(Element glyph) {
		List<Reference> references = new ArrayList<>();
		NodeList children = glyph.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			Node child = children.item(i);
			if (isSbgnElement(child, "extension") || isSbgnElement(child, "annotation")) {
				NodeList items = ((Element) child).getElementsByTagNameNS(RDF_NS, "li");
				for (int j = 0; j < items.getLength(); j++) {
					String resource = ((Element) items.item(j)).getAttributeNS(RDF_NS, "resource");
					Reference reference = parseResource(resource);
					if (reference != null) {
						references.add(reference);
					}
				}
			}
		}
		return references;
	}

	/**
	 * Parse a MIRIAM URN, or an identifiers.org URL into a reference.
	 *
	 * @param resource Resource to parse
	 * @return Reference with a lower case prefix, or null if the resource is not
	 *         recognized
	 */
	public static Reference parseResource(String resource) {
		if (resource == null || resource.isEmpty()) {
			return null;
		}
		Matcher matcher = urnPattern.matcher(resource);
		if (!matcher.matches()) {
			matcher = identifiersPattern.matcher(resource);
		}
		if (!matcher.matches()) {
			LOGGER.debug("Skipping unrecognized resource {}", resource);
			return null;
		}
		return new Reference(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
	}
}
