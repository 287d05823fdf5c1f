package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.getAttributeOrNull;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getChildGlyphs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Builds the table of compartments of a map.
 */
public class CompartmentTableBuilder {

	private static final Logger LOGGER = LogManager.getLogger(CompartmentTableBuilder.class);

	// Assign vocabularies in which to ground compartment labels
	static final List<String> COMPARTMENT_PREFIXES = List.of("go", "mesh");

	/**
	 * Build a compartment for each compartment glyph of a map, grounding its
	 * label when not empty. The parent compartment id is kept as found.
	 *
	 * @param sbgnMap  Map element
	 * @param resolver Resolver with which to ground labels
	 * @return Compartments by glyph id, in document order
	 */
	public static Map<String, Compartment> buildCompartmentTable(Element sbgnMap, GroundingResolver resolver) {
		Map<String, Compartment> compartments = new LinkedHashMap<>();
		for (Element compartment : getChildGlyphs(sbgnMap, GlyphClass.COMPARTMENT.getSbgnClass())) {
			String compartmentId = compartment.getAttribute("id");
			String compartmentLabel = LabelExtractor.getLabel(compartment);

			EntityReference entity = EntityReference.ungrounded(compartmentLabel);
			if (!compartmentLabel.isEmpty()) {
				Grounding grounding = resolver.groundLabel(compartmentLabel, COMPARTMENT_PREFIXES);
				if (grounding == null) {
					LOGGER.warn("could not find {} [id={}] in namespaces {}", compartmentLabel, compartmentId,
							COMPARTMENT_PREFIXES);
				} else {
					String name = grounding.name() != null ? grounding.name() : compartmentLabel;
					entity = new EntityReference(grounding.prefix(), grounding.identifier(), name);
				}
			}
			compartments.put(compartmentId,
					new Compartment(compartmentId, entity, getAttributeOrNull(compartment, "compartmentRef")));
		}
		return Collections.unmodifiableMap(compartments);
	}
}
