package gov.nih.nlm.sbgn;

/**
 * An explicit (prefix, identifier) cross-reference.
 *
 * @param prefix     Vocabulary prefix, lower case
 * @param identifier Identifier within the vocabulary
 */
public record Reference(String prefix, String identifier) {
}
