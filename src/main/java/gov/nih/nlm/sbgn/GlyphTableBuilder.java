package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.getAttributeOrNull;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getChildGlyphs;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getSbgnChildren;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Builds the table of entity glyphs of a map: phenotypes, simple chemicals,
 * macromolecules, nucleic acid features, and complexes.
 * <p>
 * Glyphs are first collected as drafts carrying their declared class and all
 * their references, then finalized, so that a macromolecule with several
 * references is only ever seen as a complex.
 * </p>
 */
public class GlyphTableBuilder {

	private static final Logger LOGGER = LogManager.getLogger(GlyphTableBuilder.class);

	// Assign vocabularies in which to ground glyph labels
	static final List<String> PHENOTYPE_PREFIXES = List.of("go", "efo");
	static final List<String> MOLECULE_PREFIXES = List.of("chebi", "hgnc");

	// Define a glyph before its references have been reconciled with its class
	private record GlyphDraft(String glyphId, GlyphClass declaredClass, String label, List<Reference> references,
			List<String> states, List<String> info, Compartment compartment) {
	}

	/**
	 * Build the glyph table of a map. Phenotypes are built first, then the
	 * molecular glyphs at the top level and one level inside complexes, and
	 * finally the complexes, which replace any earlier entry with the same id.
	 *
	 * @param sbgnMap      Map element
	 * @param compartments Compartments by glyph id
	 * @param resolver     Resolver with which to ground labels
	 * @return Entity glyphs by glyph id, in order of construction
	 */
	public static Map<String, MapEntity> buildGlyphTable(Element sbgnMap, Map<String, Compartment> compartments,
			GroundingResolver resolver) {
		Map<String, MapEntity> glyphs = new LinkedHashMap<>();

		// Build phenotypes
		for (Element phenotypeGlyph : getChildGlyphs(sbgnMap, GlyphClass.PHENOTYPE.getSbgnClass())) {
			String phenotypeId = getAttributeOrNull(phenotypeGlyph, "id");
			if (phenotypeId == null) {
				LOGGER.warn("phenotype glyph missing id");
				continue;
			}
			String label = LabelExtractor.getLabel(phenotypeGlyph);
			List<Reference> references = resolver.resolveReferences(phenotypeGlyph, phenotypeId,
					GlyphClass.PHENOTYPE.getSbgnClass(), label, PHENOTYPE_PREFIXES);
			glyphs.put(phenotypeId, new Glyph(phenotypeId, GlyphClass.PHENOTYPE, createEntity(references, label),
					List.of(), List.of(), null));
		}

		// Build molecular glyphs, including those inside complexes
		List<Element> candidates = new ArrayList<>(getSbgnChildren(sbgnMap, "glyph"));
		for (Element complexGlyph : getChildGlyphs(sbgnMap, GlyphClass.COMPLEX.getSbgnClass())) {
			candidates.addAll(getSbgnChildren(complexGlyph, "glyph"));
		}
		for (Element candidate : candidates) {
			GlyphDraft draft = draftGlyph(candidate, compartments, resolver);
			if (draft != null) {
				glyphs.put(draft.glyphId(), finalizeGlyph(draft));
			}
		}

		// Build complexes
		for (Element complexGlyph : getChildGlyphs(sbgnMap, GlyphClass.COMPLEX.getSbgnClass())) {
			String complexId = getAttributeOrNull(complexGlyph, "id");
			if (complexId == null) {
				LOGGER.warn("complex glyph missing id");
				continue;
			}
			String label = LabelExtractor.getLabel(complexGlyph);
			glyphs.put(complexId,
					new ComplexGlyph(complexId, label, ComplexDecomposer.decomposeComplexLabel(label)));
		}
		return Collections.unmodifiableMap(glyphs);
	}

	/**
	 * Draft a molecular glyph, skipping glyphs handled elsewhere, and glyphs with
	 * a missing or unhandled class, or a missing id.
	 */
	private static GlyphDraft draftGlyph(Element glyph, Map<String, Compartment> compartments,
			GroundingResolver resolver) {
		String sbgnClass = getAttributeOrNull(glyph, "class");
		if (sbgnClass == null) {
			LOGGER.warn("glyph missing class");
			return null;
		}
		GlyphClass glyphClass = GlyphClass.fromSbgnClass(sbgnClass);
		if (glyphClass == null || glyphClass.getRole() == GlyphClass.Role.AUXILIARY) {
			LOGGER.warn("unhandled class: {}", sbgnClass);
			return null;
		}
		if (glyphClass.getRole() != GlyphClass.Role.ENTITY || glyphClass == GlyphClass.PHENOTYPE
				|| glyphClass == GlyphClass.COMPLEX) {
			// Already handled
			return null;
		}
		String glyphId = getAttributeOrNull(glyph, "id");
		if (glyphId == null) {
			LOGGER.warn("glyph missing id");
			return null;
		}

		Compartment compartment = null;
		String compartmentId = getAttributeOrNull(glyph, "compartmentRef");
		if (compartmentId != null) {
			compartment = compartments.get(compartmentId);
			if (compartment == null) {
				LOGGER.warn("glyph {} references unknown compartment {}", glyphId, compartmentId);
			}
		}

		String label = LabelExtractor.getLabel(glyph);

		// TODO: Keep the "variable" attribute of each state, which may give the
		// modified position
		List<String> states = new ArrayList<>();
		for (Element stateVariable : getChildGlyphs(glyph, GlyphClass.STATE_VARIABLE.getSbgnClass())) {
			for (Element state : getSbgnChildren(stateVariable, "state")) {
				String value = getAttributeOrNull(state, "value");
				if (value != null) {
					states.add(value);
				}
			}
		}
		List<String> info = new ArrayList<>();
		for (Element unit : getChildGlyphs(glyph, GlyphClass.UNIT_OF_INFORMATION.getSbgnClass())) {
			for (Element unitLabel : getSbgnChildren(unit, "label")) {
				String text = getAttributeOrNull(unitLabel, "text");
				if (text != null) {
					info.add(text);
				}
			}
		}

		LOGGER.info("{} {} {}{}{}{}", sbgnClass, glyphId, label, compartment != null ? " in " + compartmentId : "",
				states.isEmpty() ? "" : " with states: " + states, info.isEmpty() ? "" : " with info: " + info);

		List<Reference> references = resolver.resolveReferences(glyph, glyphId, sbgnClass, label,
				MOLECULE_PREFIXES);
		return new GlyphDraft(glyphId, glyphClass, label, references, states, info, compartment);
	}

	/**
	 * Reconcile the references of a draft with its class. A macromolecule with
	 * several references is taken to be a complex; any other glyph with several
	 * references keeps the first one.
	 */
	private static Glyph finalizeGlyph(GlyphDraft draft) {
		GlyphClass glyphClass = draft.declaredClass();
		if (draft.references().size() > 1) {
			if (glyphClass == GlyphClass.MACROMOLECULE) {
				LOGGER.warn("multiple references for {} [id={}, class={}]. Should be a complex?", draft.label(),
						draft.glyphId(), glyphClass);
				glyphClass = GlyphClass.COMPLEX;
			} else {
				// TODO: Decompose into a complex, as for macromolecules
				LOGGER.warn("{} {} {} has multiple references", glyphClass, draft.glyphId(), draft.label());
			}
		}
		return new Glyph(draft.glyphId(), glyphClass, createEntity(draft.references(), draft.label()),
				draft.states(), draft.info(), draft.compartment());
	}

	private static EntityReference createEntity(List<Reference> references, String label) {
		if (references.isEmpty()) {
			return EntityReference.ungrounded(label);
		}
		Reference reference = references.get(0);
		return new EntityReference(reference.prefix(), reference.identifier(), label);
	}
}
