package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reference to an entity in a controlled vocabulary, with a display name. The
 * prefix and identifier are null when the entity could not be grounded.
 *
 * @param prefix     Vocabulary prefix, or null
 * @param identifier Identifier within the vocabulary, or null
 * @param name       Display name
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record EntityReference(String prefix, String identifier, String name) {

	/**
	 * Prefix and identifier of a member of a family of paralogs, which is
	 * deliberately left ungrounded
	 */
	public static final String UNKNOWN = "?";

	public EntityReference {
		if (prefix != null && identifier == null) {
			throw new IllegalArgumentException("Entity " + name + " has prefix " + prefix + " but no identifier");
		}
	}

	/**
	 * Create a reference for an entity that could not be grounded.
	 *
	 * @param name Display name
	 * @return Ungrounded reference
	 */
	public static EntityReference ungrounded(String name) {
		return new EntityReference(null, null, name);
	}

	/**
	 * Create a reference for a member of a family of paralogs.
	 *
	 * @param name Display name
	 * @return Reference using the unknown sentinel
	 */
	public static EntityReference unknown(String name) {
		return new EntityReference(UNKNOWN, UNKNOWN, name);
	}

	@JsonIgnore
	public boolean isGrounded() {
		return prefix != null;
	}
}
