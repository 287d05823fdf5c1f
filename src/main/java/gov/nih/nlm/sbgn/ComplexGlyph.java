package gov.nih.nlm.sbgn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A complex glyph, decomposed into constituents by its label.
 *
 * @param glyphId    Glyph id
 * @param label      Raw complex label
 * @param components Constituents by label, in label order
 */
public record ComplexGlyph(@JsonProperty("glyph_id") String glyphId, String label,
		Map<String, ComplexComponent> components) implements MapEntity {

	public ComplexGlyph {
		components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
	}

	@Override
	@JsonProperty("class")
	public GlyphClass glyphClass() {
		return GlyphClass.COMPLEX;
	}
}
