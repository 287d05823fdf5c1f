package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.XHTML_NS;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getChildren;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getSbgnChildren;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Converts an SBGN-ML document into an intermediate graph description: arcs
 * grouped by the process they enter or leave, and arcs between entity glyphs.
 * <p>
 * Every call builds its own tables, so a parser may be shared by threads
 * provided its grounding service can be.
 * </p>
 */
public class SbgnMapParser {

	private static final Logger LOGGER = LogManager.getLogger(SbgnMapParser.class);

	private final GroundingService groundingService;

	public SbgnMapParser(GroundingService groundingService) {
		this.groundingService = groundingService;
	}

	/**
	 * Parse an SBGN-ML file.
	 *
	 * @param sbgnFile Path to the file
	 * @return Graph description of the single map in the file
	 */
	public SbgnMapResult parseSbgnFile(Path sbgnFile) {
		LOGGER.info("Parsing {}", sbgnFile);
		return parseSbgnDocument(SbgnXmlReader.parseXmlFile(sbgnFile.toFile()));
	}

	/**
	 * Parse an SBGN-ML document, which must contain exactly one map.
	 *
	 * @param doc SBGN-ML document
	 * @return Graph description of the map
	 * @throws SbgnFormatException if the document contains no map, or more than
	 *                             one
	 */
	public SbgnMapResult parseSbgnDocument(Document doc) {
		List<Element> maps = getSbgnChildren(doc.getDocumentElement(), "map");
		if (maps.size() > 1) {
			throw new SbgnFormatException("not supporting multiple maps in one document: found " + maps.size());
		}
		if (maps.isEmpty()) {
			throw new SbgnFormatException("no map found in document");
		}
		return handleSbgnMap(maps.get(0));
	}

	/**
	 * Build the compartment, port, and glyph tables of a map, then resolve, and
	 * classify its arcs.
	 *
	 * @param sbgnMap Map element
	 * @return Graph description of the map
	 */
	public SbgnMapResult handleSbgnMap(Element sbgnMap) {
		GroundingResolver resolver = new GroundingResolver(groundingService);
		Map<String, Compartment> compartments = CompartmentTableBuilder.buildCompartmentTable(sbgnMap, resolver);
		ProcessPortIndex index = ProcessPortIndex.buildProcessPortIndex(sbgnMap);
		Map<String, MapEntity> glyphs = GlyphTableBuilder.buildGlyphTable(sbgnMap, compartments, resolver);

		ArcResolver.ArcResolution resolution = ArcResolver.resolveArcs(sbgnMap, glyphs, index);
		ArcReifier.Reification reification = ArcReifier.reifyArcs(resolution.arcs());
		if (!resolver.getFailedLabels().isEmpty()) {
			LOGGER.info("Could not ground {} labels", resolver.getFailedLabels().size());
		}
		return new SbgnMapResult(getTitle(sbgnMap), reification.reified(), reification.direct());
	}

	/**
	 * Get the title of a map from the body of its notes.
	 *
	 * @param sbgnMap Map element
	 * @return Trimmed text of the body, or null if the map has no notes body
	 */
	public static String getTitle(Element sbgnMap) {
		for (Element notes : getSbgnChildren(sbgnMap, "notes")) {
			for (Element html : getChildren(notes, XHTML_NS, "html")) {
				for (Element body : getChildren(html, XHTML_NS, "body")) {
					return getLeadingText(body).strip();
				}
			}
		}
		return null;
	}

	// Collect the text preceding the first child element
	private static String getLeadingText(Element element) {
		StringBuilder text = new StringBuilder();
		NodeList nodeList = element.getChildNodes();
		for (int i = 0; i < nodeList.getLength(); i++) {
			Node node = nodeList.item(i);
			if (node.getNodeType() == Node.ELEMENT_NODE) {
				break;
			}
			if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
				text.append(node.getNodeValue());
			}
		}
		return text.toString();
	}
}
