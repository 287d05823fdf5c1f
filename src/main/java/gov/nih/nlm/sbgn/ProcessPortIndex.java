package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.SbgnXmlReader.getSbgnChildren;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Indexes the ports of process and logic gate glyphs, since arcs reference
 * ports rather than the glyphs owning them.
 *
 * @param portToProcess Owning process id by port id
 * @param processToPorts Port ids by process id, including processes without ports
 * @param portToGate    Owning logic gate id by port id
 * @param gateToPorts   Port ids by logic gate id, including gates without ports
 */
public record ProcessPortIndex(Map<String, String> portToProcess, Map<String, List<String>> processToPorts,
		Map<String, String> portToGate, Map<String, List<String>> gateToPorts) {

	private static final Logger LOGGER = LogManager.getLogger(ProcessPortIndex.class);

	/**
	 * Index the ports of every process, and logic gate glyph of a map. A port
	 * registered to a second owner is rewritten to the later owner.
	 *
	 * @param sbgnMap Map element
	 * @return Port index
	 */
	public static ProcessPortIndex buildProcessPortIndex(Element sbgnMap) {
		Map<String, String> portToProcess = new LinkedHashMap<>();
		Map<String, List<String>> processToPorts = new LinkedHashMap<>();
		Map<String, String> portToGate = new LinkedHashMap<>();
		Map<String, List<String>> gateToPorts = new LinkedHashMap<>();
		for (Element glyph : getSbgnChildren(sbgnMap, "glyph")) {
			GlyphClass glyphClass = GlyphClass.fromSbgnClass(glyph.getAttribute("class"));
			if (glyphClass == null) {
				continue;
			}
			if (glyphClass.isProcess()) {
				indexPorts(glyph, portToProcess, processToPorts);
			} else if (glyphClass.isLogicGate()) {
				indexPorts(glyph, portToGate, gateToPorts);
			}
		}
		return new ProcessPortIndex(Collections.unmodifiableMap(portToProcess), freeze(processToPorts),
				Collections.unmodifiableMap(portToGate), freeze(gateToPorts));
	}

	private static void indexPorts(Element owner, Map<String, String> portToOwner,
			Map<String, List<String>> ownerToPorts) {
		String ownerId = owner.getAttribute("id");
		List<String> ports = ownerToPorts.computeIfAbsent(ownerId, k -> new ArrayList<>());
		for (Element port : getSbgnChildren(owner, "port")) {
			String portId = port.getAttribute("id");
			ports.add(portId);
			String previousOwnerId = portToOwner.put(portId, ownerId);
			if (previousOwnerId != null && !previousOwnerId.equals(ownerId)) {
				LOGGER.warn("rewriting port {} from {} to {}", portId, previousOwnerId, ownerId);
			}
		}
	}

	private static Map<String, List<String>> freeze(Map<String, List<String>> ownerToPorts) {
		Map<String, List<String>> frozen = new LinkedHashMap<>();
		ownerToPorts.forEach((ownerId, ports) -> frozen.put(ownerId, List.copyOf(ports)));
		return Collections.unmodifiableMap(frozen);
	}

	/**
	 * Test if an id is the id of a process, or a logic gate.
	 * <p>
	 * An id used by both a process and a logic gate is not disambiguated.
	 * </p>
	 *
	 * @param id Id to test
	 * @return True if a process or a logic gate has the id
	 */
	public boolean isProcessOrGate(String id) {
		return processToPorts.containsKey(id) || gateToPorts.containsKey(id);
	}
}
