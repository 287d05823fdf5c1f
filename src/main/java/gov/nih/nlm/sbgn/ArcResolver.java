package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.getAttributeOrNull;
import static gov.nih.nlm.sbgn.SbgnXmlReader.getSbgnChildren;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Resolves the endpoints of every arc of a map to an entity glyph, or to the
 * process or logic gate owning the referenced port.
 */
public class ArcResolver {

	private static final Logger LOGGER = LogManager.getLogger(ArcResolver.class);

	/**
	 * Arcs resolved from a map, with counts of the arcs resolved, and skipped.
	 *
	 * @param arcs       Resolved arcs, in document order
	 * @param successful Number of arcs resolved
	 * @param failures   Number of arcs skipped
	 */
	public record ArcResolution(List<ResolvedArc> arcs, int successful, int failures) {
	}

	/**
	 * Resolve every arc of a map. Arcs missing a class, id, source, or target, and
	 * arcs with an endpoint which cannot be resolved are counted as failures, and
	 * skipped.
	 *
	 * @param sbgnMap Map element
	 * @param glyphs  Entity glyphs by glyph id
	 * @param index   Port index
	 * @return Resolved arcs, and counts
	 */
	public static ArcResolution resolveArcs(Element sbgnMap, Map<String, MapEntity> glyphs, ProcessPortIndex index) {
		Map<String, ResolvedArc> arcs = new LinkedHashMap<>();
		int successful = 0;
		int failures = 0;
		for (Element arc : getSbgnChildren(sbgnMap, "arc")) {
			String arcClass = getAttributeOrNull(arc, "class");
			if (arcClass == null) {
				LOGGER.warn("arc has no class");
				failures++;
				continue;
			}
			String arcId = getAttributeOrNull(arc, "id");
			if (arcId == null) {
				LOGGER.warn("arc has no id");
				failures++;
				continue;
			}
			String sourceId = getAttributeOrNull(arc, "source");
			if (sourceId == null) {
				LOGGER.warn("arc:{} has no source", arcId);
				failures++;
				continue;
			}
			ArcEndpoint source = resolveEndpoint(sourceId, glyphs, index);
			if (source == null) {
				LOGGER.warn("can not find source {}", sourceId);
				failures++;
				continue;
			}
			String targetId = getAttributeOrNull(arc, "target");
			if (targetId == null) {
				LOGGER.warn("arc:{} has no target", arcId);
				failures++;
				continue;
			}
			ArcEndpoint target = resolveEndpoint(targetId, glyphs, index);
			if (target == null) {
				LOGGER.warn("can not find target {}", targetId);
				failures++;
				continue;
			}
			successful++;
			if (arcs.containsKey(arcId)) {
				LOGGER.warn("replacing arc with duplicate id {}", arcId);
			}
			arcs.put(arcId, new ResolvedArc(arcId, arcClass, source, target));
		}
		LOGGER.warn("successful: {} / failure: {}", successful, failures);
		return new ArcResolution(List.copyOf(new ArrayList<>(arcs.values())), successful, failures);
	}

	/**
	 * Resolve an arc endpoint id to an entity glyph, a process or logic gate, or
	 * the process or logic gate owning a port, in that order.
	 *
	 * @param id     Endpoint id
	 * @param glyphs Entity glyphs by glyph id
	 * @param index  Port index
	 * @return Endpoint, or null if the id cannot be resolved
	 */
	public static ArcEndpoint resolveEndpoint(String id, Map<String, MapEntity> glyphs, ProcessPortIndex index) {
		MapEntity entity = glyphs.get(id);
		if (entity != null) {
			return ArcEndpoint.node(entity);
		}
		// TODO: Differentiate between processes and logic gates sharing an id
		if (index.isProcessOrGate(id)) {
			return ArcEndpoint.process(id);
		}
		String processId = index.portToProcess().get(id);
		if (processId != null) {
			return ArcEndpoint.process(processId);
		}
		String gateId = index.portToGate().get(id);
		if (gateId != null) {
			return ArcEndpoint.process(gateId);
		}
		return null;
	}
}
