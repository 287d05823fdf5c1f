package gov.nih.nlm.sbgn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Resolves the references of a glyph, preferring the references embedded in
 * its annotation, and falling back to grounding its label.
 */
public class GroundingResolver {

	private static final Logger LOGGER = LogManager.getLogger(GroundingResolver.class);

	private final GroundingService groundingService;
	private final List<String> failedLabels = new ArrayList<>();

	public GroundingResolver(GroundingService groundingService) {
		this.groundingService = groundingService;
	}

	/**
	 * Resolve the references of a glyph. Embedded references are returned
	 * verbatim, and the grounding service is only consulted when there are none.
	 *
	 * @param glyph      Glyph element
	 * @param glyphId    Glyph id, for logging
	 * @param glyphClass Glyph class, for logging
	 * @param label      Glyph label
	 * @param prefixes   Candidate vocabulary prefixes
	 * @return Embedded references, a single grounded reference, or an empty list
	 */
	public List<Reference> resolveReferences(Element glyph, String glyphId, String glyphClass, String label,
			List<String> prefixes) {
		List<Reference> references = LabelExtractor.getReferences(glyph);
		if (!references.isEmpty()) {
			return references;
		}
		LOGGER.warn("no references for {} [id={}, class={}]. Trying grounding with {}", label, glyphId, glyphClass,
				prefixes);
		Grounding grounding = groundLabel(label, prefixes);
		if (grounding == null) {
			LOGGER.warn("grounding failed for {} [id={}, class={}] with {}", label, glyphId, glyphClass, prefixes);
			return Collections.emptyList();
		}
		return List.of(grounding.toReference());
	}

	/**
	 * Ground a label against the candidate vocabularies, recording a failure if
	 * no vocabulary contains it.
	 *
	 * @param label    Label to ground
	 * @param prefixes Candidate vocabulary prefixes
	 * @return Grounding, or null
	 */
	public Grounding groundLabel(String label, List<String> prefixes) {
		Grounding grounding = null;
		if (label != null && !label.isEmpty()) {
			grounding = groundingService.ground(prefixes, label);
		}
		if (grounding == null) {
			failedLabels.add(label == null ? "" : label);
		}
		return grounding;
	}

	/**
	 * @return Labels which could not be grounded, in order of attempt
	 */
	public List<String> getFailedLabels() {
		return Collections.unmodifiableList(failedLabels);
	}
}
