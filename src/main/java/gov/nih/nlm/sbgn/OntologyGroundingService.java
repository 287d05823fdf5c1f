package gov.nih.nlm.sbgn;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Grounds text by exact, case insensitive match against the names and exact
 * synonyms of local vocabularies.
 */
public class OntologyGroundingService implements GroundingService {

	private static final Logger LOGGER = LogManager.getLogger(OntologyGroundingService.class);

	private final Map<String, Vocabulary> vocabularies;

	/**
	 * Construct a service using vocabularies, which must not be modified
	 * afterwards.
	 *
	 * @param vocabularies Vocabularies by prefix
	 */
	public OntologyGroundingService(Map<String, Vocabulary> vocabularies) {
		this.vocabularies = Collections.unmodifiableMap(new HashMap<>(vocabularies));
	}

	/**
	 * Create a service using the terms in ontology files, and the bundled HGNC,
	 * and ChEBI name tables. Terms parsed from ontology files take precedence.
	 *
	 * @param owlFiles Paths to ontology files
	 * @return Grounding service
	 */
	public static OntologyGroundingService createGroundingService(List<Path> owlFiles) {
		Map<String, Vocabulary> vocabularies = new HashMap<>();
		vocabularies.put("hgnc", VocabularyParser.createVocabulary("hgnc", VocabularyTables.hgncNameToId()));
		vocabularies.put("chebi", VocabularyParser.createVocabulary("chebi", VocabularyTables.chebiNameToId()));
		for (Path owlFile : owlFiles) {
			VocabularyParser.parseVocabularyFile(owlFile, vocabularies);
		}
		for (Vocabulary vocabulary : vocabularies.values()) {
			LOGGER.info("Grounding with {} terms from {}", vocabulary.size(), vocabulary.prefix);
		}
		return new OntologyGroundingService(vocabularies);
	}

	@Override
	public Grounding ground(List<String> prefixes, String text) {
		for (String prefix : prefixes) {
			Vocabulary vocabulary = vocabularies.get(prefix.toLowerCase(Locale.ROOT));
			if (vocabulary == null) {
				continue;
			}
			Grounding grounding = vocabulary.findTerm(text);
			if (grounding != null) {
				return grounding;
			}
		}
		return null;
	}

	/**
	 * @return Prefixes of the vocabularies available for grounding
	 */
	public Set<String> getPrefixes() {
		return vocabularies.keySet();
	}
}
