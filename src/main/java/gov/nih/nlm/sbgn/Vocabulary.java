package gov.nih.nlm.sbgn;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Contains the terms of one controlled vocabulary, indexed by identifier and by
 * name for grounding.
 */
public class Vocabulary {

	/**
	 * Vocabulary prefix, lower case
	 */
	public final String prefix;
	/**
	 * Mapping from identifier to canonical name
	 */
	public final Map<String, String> labels;
	/**
	 * Mapping from lower case name or exact synonym to identifier
	 */
	public final Map<String, String> names;

	public Vocabulary(String prefix) {
		this.prefix = prefix.toLowerCase(Locale.ROOT);
		labels = new HashMap<>();
		names = new HashMap<>();
	}

	/**
	 * Add a term with its canonical name. A canonical name replaces a synonym
	 * with the same text.
	 *
	 * @param identifier Term identifier
	 * @param label      Canonical name
	 */
	public void addTerm(String identifier, String label) {
		labels.put(identifier, label);
		names.put(normalize(label), identifier);
	}

	/**
	 * Add an exact synonym of a term, unless the text is already a name.
	 *
	 * @param identifier Term identifier
	 * @param synonym    Exact synonym
	 */
	public void addSynonym(String identifier, String synonym) {
		names.putIfAbsent(normalize(synonym), identifier);
	}

	/**
	 * Find the term with a name or exact synonym, ignoring case and surrounding
	 * white space.
	 *
	 * @param name Name to find
	 * @return Grounding of the term, or null
	 */
	public Grounding findTerm(String name) {
		String identifier = names.get(normalize(name));
		if (identifier == null) {
			return null;
		}
		return new Grounding(prefix, identifier, labels.getOrDefault(identifier, name));
	}

	public int size() {
		return labels.size();
	}

	private static String normalize(String name) {
		return name.strip().toLowerCase(Locale.ROOT);
	}
}
