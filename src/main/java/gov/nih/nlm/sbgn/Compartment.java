package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named containment region of a map.
 *
 * @param glyphId Compartment glyph id
 * @param entity  Grounded, or raw compartment name
 * @param parent  Id of the enclosing compartment, or null. Not validated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Compartment(@JsonProperty("glyph_id") String glyphId, EntityReference entity, String parent) {
}
