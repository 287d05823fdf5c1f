package gov.nih.nlm.sbgn;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.lang.CollectorStreamTriples;
import org.apache.jena.vocabulary.RDFS;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Parses OBO style OWL files into vocabularies of term names and exact
 * synonyms, keyed by the prefix of each term.
 */
public class VocabularyParser {

	private static final Logger LOGGER = LogManager.getLogger(VocabularyParser.class);

	static final String HAS_EXACT_SYNONYM = "http://www.geneontology.org/formats/oboInOwl#hasExactSynonym";

	// Define a record describing a term parsed from its IRI
	public record TermId(String prefix, String identifier) {
	}

	/**
	 * Parse a term IRI, such as http://purl.obolibrary.org/obo/GO_0005737, into a
	 * lower case prefix and an identifier.
	 *
	 * @param n Node from which to parse the term
	 * @return Term id, or null if the node is not a term IRI
	 */
	public static TermId parseTermId(Node n) {
		if (!n.isURI()) {
			return null;
		}
		String uri = n.getURI();
		String term = uri.substring(Math.max(uri.lastIndexOf('/'), uri.lastIndexOf('#')) + 1);
		int separator = term.indexOf('_');
		if (separator <= 0 || separator == term.length() - 1) {
			return null;
		}
		return new TermId(term.substring(0, separator).toLowerCase(Locale.ROOT), term.substring(separator + 1));
	}

	/**
	 * Parse the labels, and exact synonyms of the terms in an ontology file.
	 * Obsolete terms are skipped.
	 *
	 * @param owlFile      Path to ontology file
	 * @param vocabularies Vocabularies by prefix, to which terms are added
	 */
	public static void parseVocabularyFile(Path owlFile, Map<String, Vocabulary> vocabularies) {
		LOGGER.info("Parsing vocabulary terms in {}", owlFile.getFileName());
		CollectorStreamTriples inputStream = new CollectorStreamTriples();
		RDFParser.source(owlFile).parse(inputStream);

		// Add labels before synonyms, so that a label always wins
		int nTerms = 0;
		for (Triple triple : inputStream.getCollected()) {
			if (!triple.getPredicate().getURI().equals(RDFS.label.getURI()) || !triple.getObject().isLiteral()) {
				continue;
			}
			TermId termId = parseTermId(triple.getSubject());
			String label = triple.getObject().getLiteralLexicalForm();
			if (termId == null || label.startsWith("obsolete")) {
				continue;
			}
			vocabularies.computeIfAbsent(termId.prefix(), Vocabulary::new).addTerm(termId.identifier(), label);
			nTerms++;
		}
		for (Triple triple : inputStream.getCollected()) {
			if (!triple.getPredicate().getURI().equals(HAS_EXACT_SYNONYM) || !triple.getObject().isLiteral()) {
				continue;
			}
			TermId termId = parseTermId(triple.getSubject());
			if (termId == null || !vocabularies.containsKey(termId.prefix())
					|| !vocabularies.get(termId.prefix()).labels.containsKey(termId.identifier())) {
				continue;
			}
			vocabularies.get(termId.prefix()).addSynonym(termId.identifier(),
					triple.getObject().getLiteralLexicalForm());
		}
		LOGGER.info("Parsed {} terms from {}", nTerms, owlFile.getFileName());
	}

	/**
	 * Parse ontology files into vocabularies.
	 *
	 * @param owlFiles Paths to ontology files
	 * @return Vocabularies by prefix
	 */
	static Map<String, Vocabulary> parseVocabularies(List<Path> owlFiles) {
		Map<String, Vocabulary> vocabularies = new HashMap<>();
		for (Path owlFile : owlFiles) {
			parseVocabularyFile(owlFile, vocabularies);
		}
		return vocabularies;
	}

	/**
	 * Create a vocabulary from a name to identifier table.
	 *
	 * @param prefix   Vocabulary prefix
	 * @param nameToId Identifiers by canonical name
	 * @return Vocabulary
	 */
	public static Vocabulary createVocabulary(String prefix, Map<String, String> nameToId) {
		Vocabulary vocabulary = new Vocabulary(prefix);
		nameToId.forEach((name, identifier) -> vocabulary.addTerm(identifier, name));
		return vocabulary;
	}
}
