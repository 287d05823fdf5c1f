package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An arc between a process and an entity glyph, seen from the process.
 *
 * @param arcId    Arc id
 * @param arcClass Relationship type
 * @param glyph    Entity glyph at the other end of the arc
 */
public record ReifiedArc(@JsonProperty("arc_id") String arcId, @JsonProperty("arc_class") String arcClass,
		MapEntity glyph) {
}
