package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Post-translational modification inferred from the suffix of a complex
 * component label.
 */
public enum ModificationTag {

	UBIQUITINATION("-ubq", "ubq"), PHOSPHORYLATION("-P", "P");

	private final String suffix;
	private final String tag;

	ModificationTag(String suffix, String tag) {
		this.suffix = suffix;
		this.tag = tag;
	}

	/**
	 * @return Label suffix marking the modification
	 */
	public String getSuffix() {
		return suffix;
	}

	@JsonValue
	public String getTag() {
		return tag;
	}
}
