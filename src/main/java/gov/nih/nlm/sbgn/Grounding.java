package gov.nih.nlm.sbgn;

/**
 * Result of grounding free text to a vocabulary term.
 *
 * @param prefix     Vocabulary prefix, lower case
 * @param identifier Identifier within the vocabulary
 * @param name       Canonical name of the term
 */
public record Grounding(String prefix, String identifier, String name) {

	public Reference toReference() {
		return new Reference(prefix, identifier);
	}
}
