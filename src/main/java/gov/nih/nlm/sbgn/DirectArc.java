package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An arc between two entity glyphs.
 *
 * @param arcId    Arc id
 * @param arcClass Relationship type
 * @param source   Source glyph
 * @param target   Target glyph
 */
public record DirectArc(@JsonProperty("arc_id") String arcId, @JsonProperty("arc_class") String arcClass,
		MapEntity source, MapEntity target) {
}
