package gov.nih.nlm.sbgn;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decomposes the colon delimited label of a complex into its constituents.
 * Constituents are grounded using the static vocabulary tables only.
 */
public class ComplexDecomposer {

	private static final Logger LOGGER = LogManager.getLogger(ComplexDecomposer.class);

	// Assign nucleotide cofactors grounded in ChEBI rather than HGNC
	static final Set<String> NUCLEOTIDES = Set.of("GTP", "GDP", "ATP", "ADP");

	// Assign suffix marking a family of paralogs with ascending numbers
	static final String PARALOG_FAMILY_SUFFIX = "*";

	/**
	 * Decompose a complex label into constituents. The first matching rule
	 * applies to each constituent: a ubiquitination or phosphorylation suffix is
	 * stripped and the remainder grounded in HGNC, a paralog family is left
	 * unknown, a nucleotide is grounded in ChEBI, and anything else in HGNC.
	 * Empty constituents, as in "TP53:", are kept.
	 *
	 * @param label Complex label
	 * @return Constituents by label, in label order
	 */
	public static Map<String, ComplexComponent> decomposeComplexLabel(String label) {
		Map<String, ComplexComponent> components = new LinkedHashMap<>();
		if (label == null || label.isEmpty()) {
			return components;
		}
		for (String componentLabel : label.split(":", -1)) {
			ModificationTag tag = null;
			EntityReference entity;
			if (componentLabel.endsWith(ModificationTag.UBIQUITINATION.getSuffix())) {
				tag = ModificationTag.UBIQUITINATION;
				componentLabel = stripSuffix(componentLabel, tag.getSuffix());
				entity = lookup("hgnc", VocabularyTables.hgncNameToId(), componentLabel);
			} else if (componentLabel.endsWith(ModificationTag.PHOSPHORYLATION.getSuffix())) {
				tag = ModificationTag.PHOSPHORYLATION;
				componentLabel = stripSuffix(componentLabel, tag.getSuffix());
				entity = lookup("hgnc", VocabularyTables.hgncNameToId(), componentLabel);
			} else if (componentLabel.endsWith(PARALOG_FAMILY_SUFFIX)) {
				entity = EntityReference.unknown(componentLabel);
			} else if (NUCLEOTIDES.contains(componentLabel)) {
				entity = lookup("chebi", VocabularyTables.chebiNameToId(), componentLabel);
			} else {
				entity = lookup("hgnc", VocabularyTables.hgncNameToId(), componentLabel);
			}
			components.put(componentLabel, new ComplexComponent(entity, tag));
		}
		return components;
	}

	private static String stripSuffix(String componentLabel, String suffix) {
		return componentLabel.substring(0, componentLabel.length() - suffix.length());
	}

	private static EntityReference lookup(String prefix, Map<String, String> nameToId, String name) {
		String identifier = nameToId.get(name);
		if (identifier == null) {
			LOGGER.debug("{} not found in {}", name, prefix);
			return EntityReference.ungrounded(name);
		}
		return new EntityReference(prefix, identifier, name);
	}
}
