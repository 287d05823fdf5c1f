package gov.nih.nlm.sbgn;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One constituent of a complex, parsed from the complex label.
 *
 * @param entity Entity reference of the constituent
 * @param tag    Modification of the constituent, or null
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ComplexComponent(EntityReference entity, @JsonProperty("tags") ModificationTag tag) {
}
