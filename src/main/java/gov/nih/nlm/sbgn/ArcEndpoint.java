package gov.nih.nlm.sbgn;

/**
 * Resolved endpoint of an arc: either an entity glyph, or a process or logic
 * gate referenced by id.
 *
 * @param kind      Kind of endpoint
 * @param entity    Entity glyph, when the kind is NODE
 * @param processId Process or logic gate id, when the kind is PROCESS
 */
public record ArcEndpoint(Kind kind, MapEntity entity, String processId) {

	public enum Kind {
		NODE, PROCESS
	}

	public static ArcEndpoint node(MapEntity entity) {
		return new ArcEndpoint(Kind.NODE, entity, null);
	}

	public static ArcEndpoint process(String processId) {
		return new ArcEndpoint(Kind.PROCESS, null, processId);
	}

	/**
	 * @return Glyph id of the entity, or the process id
	 */
	public String id() {
		return kind == Kind.NODE ? entity.glyphId() : processId;
	}
}
