package gov.nih.nlm.sbgn;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A simple chemical, macromolecule, nucleic acid feature, or phenotype glyph.
 *
 * @param glyphId     Glyph id
 * @param glyphClass  Glyph class, possibly reclassified to complex
 * @param entity      Entity reference, grounded when possible
 * @param states      Values of the state variables
 * @param info        Labels of the units of information
 * @param compartment Copy of the containing compartment, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Glyph(@JsonProperty("glyph_id") String glyphId, @JsonProperty("class") GlyphClass glyphClass,
		EntityReference entity, List<String> states, List<String> info, Compartment compartment)
		implements MapEntity {

	public Glyph {
		states = List.copyOf(states);
		info = List.copyOf(info);
	}
}
