package gov.nih.nlm.sbgn;

import static gov.nih.nlm.sbgn.PathUtilities.listFilesMatchingPattern;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.arangodb.ArangoDatabase;
import com.arangodb.ArangoEdgeCollection;
import com.arangodb.ArangoGraph;
import com.arangodb.ArangoVertexCollection;
import com.arangodb.entity.BaseDocument;
import com.arangodb.entity.BaseEdgeDocument;

/**
 * Loads the graph descriptions of the SBGN-ML files in the data/sbgn directory
 * into a local ArangoDB server instance. Entity glyphs and processes become
 * vertices, and arcs become edges labeled by their relationship type.
 */
public class SbgnGraphLoader {

	private static final Logger LOGGER = LogManager.getLogger(SbgnGraphLoader.class);

	// Assign vertex collection names
	public static final String ENTITY = "entity";
	public static final String PROCESS = "process";

	// Assign pattern for matching characters not allowed in document keys
	private static final Pattern invalidKeyPattern = Pattern.compile("[^A-Za-z0-9_\\-:.@()+,=;$!*'%]");

	/**
	 * Vertex, and edge documents by collection name, and document key.
	 */
	public static class GraphDocuments {

		/**
		 * Vertex documents by vertex collection name, and key
		 */
		public final Map<String, Map<String, BaseDocument>> vertexDocuments = new LinkedHashMap<>();
		/**
		 * Edge documents by edge collection name, and key
		 */
		public final Map<String, Map<String, BaseEdgeDocument>> edgeDocuments = new LinkedHashMap<>();

		public int countVertices() {
			return vertexDocuments.values().stream().mapToInt(Map::size).sum();
		}

		public int countEdges() {
			return edgeDocuments.values().stream().mapToInt(Map::size).sum();
		}
	}

	/**
	 * Create a document key unique across maps from a map name, and a glyph or arc
	 * id, replacing characters ArangoDB does not allow in keys.
	 *
	 * @param mapName Map name
	 * @param id      Glyph, process, or arc id
	 * @return Document key
	 */
	public static String createDocumentKey(String mapName, String id) {
		return invalidKeyPattern.matcher(mapName + "." + id).replaceAll("_");
	}

	/**
	 * Construct a vertex document for an entity glyph.
	 *
	 * @param mapName Map name
	 * @param entity  Entity glyph
	 * @return Vertex document
	 */
	public static BaseDocument constructEntityDocument(String mapName, MapEntity entity) {
		BaseDocument doc = new BaseDocument(createDocumentKey(mapName, entity.glyphId()));
		doc.addAttribute("map", mapName);
		doc.addAttribute("glyph_id", entity.glyphId());
		doc.addAttribute("class", entity.glyphClass().getSbgnClass());
		if (entity instanceof Glyph) {
			Glyph glyph = (Glyph) entity;
			addEntityAttributes(doc, glyph.entity());
			doc.addAttribute("states", glyph.states());
			doc.addAttribute("info", glyph.info());
			if (glyph.compartment() != null) {
				doc.addAttribute("compartment", glyph.compartment().entity().name());
			}
		} else if (entity instanceof ComplexGlyph) {
			ComplexGlyph complex = (ComplexGlyph) entity;
			doc.addAttribute("name", complex.label());
			List<Map<String, Object>> components = new ArrayList<>();
			for (ComplexComponent component : complex.components().values()) {
				Map<String, Object> attributes = new LinkedHashMap<>();
				attributes.put("name", component.entity().name());
				attributes.put("prefix", component.entity().prefix());
				attributes.put("identifier", component.entity().identifier());
				attributes.put("tag", component.tag() != null ? component.tag().getTag() : null);
				components.add(attributes);
			}
			doc.addAttribute("components", components);
		}
		return doc;
	}

	private static void addEntityAttributes(BaseDocument doc, EntityReference entity) {
		doc.addAttribute("name", entity.name());
		if (entity.isGrounded()) {
			doc.addAttribute("prefix", entity.prefix());
			doc.addAttribute("identifier", entity.identifier());
		}
	}

	/**
	 * Construct vertex, and edge documents for the graph description of a map.
	 *
	 * @param mapName   Map name
	 * @param result    Graph description
	 * @param documents Documents to which to add
	 */
	public static void constructDocuments(String mapName, SbgnMapResult result, GraphDocuments documents) {
		for (ReifiedGroup group : result.reified()) {
			String processKey = addProcessVertex(mapName, group.process(), documents);
			for (List<ReifiedArc> arcs : group.targets().values()) {
				for (ReifiedArc arc : arcs) {
					String entityKey = addEntityVertex(mapName, arc.glyph(), documents);
					addEdge(mapName, arc.arcId(), arc.arcClass(), PROCESS, processKey, ENTITY, entityKey, documents);
				}
			}
			for (List<ReifiedArc> arcs : group.sources().values()) {
				for (ReifiedArc arc : arcs) {
					String entityKey = addEntityVertex(mapName, arc.glyph(), documents);
					addEdge(mapName, arc.arcId(), arc.arcClass(), ENTITY, entityKey, PROCESS, processKey, documents);
				}
			}
		}
		for (DirectArc arc : result.direct()) {
			String sourceKey = addEntityVertex(mapName, arc.source(), documents);
			String targetKey = addEntityVertex(mapName, arc.target(), documents);
			addEdge(mapName, arc.arcId(), arc.arcClass(), ENTITY, sourceKey, ENTITY, targetKey, documents);
		}
	}

	private static String addProcessVertex(String mapName, String processId, GraphDocuments documents) {
		String key = createDocumentKey(mapName, processId);
		documents.vertexDocuments.computeIfAbsent(PROCESS, k -> new LinkedHashMap<>()).computeIfAbsent(key, k -> {
			BaseDocument doc = new BaseDocument(key);
			doc.addAttribute("map", mapName);
			doc.addAttribute("glyph_id", processId);
			return doc;
		});
		return key;
	}

	private static String addEntityVertex(String mapName, MapEntity entity, GraphDocuments documents) {
		String key = createDocumentKey(mapName, entity.glyphId());
		documents.vertexDocuments.computeIfAbsent(ENTITY, k -> new LinkedHashMap<>()).computeIfAbsent(key,
				k -> constructEntityDocument(mapName, entity));
		return key;
	}

	private static void addEdge(String mapName, String arcId, String arcClass, String fromName, String fromKey,
			String toName, String toKey, GraphDocuments documents) {
		String key = createDocumentKey(mapName, arcId);
		BaseEdgeDocument doc = new BaseEdgeDocument(key, fromName + "/" + fromKey, toName + "/" + toKey);
		doc.addAttribute("label", arcClass);
		doc.addAttribute("map", mapName);
		documents.edgeDocuments
				.computeIfAbsent(ArangoDbUtilities.getEdgeCollectionName(fromName, toName), k -> new LinkedHashMap<>())
				.put(key, doc);
	}

	/**
	 * Insert, or update all vertices, then all edges.
	 *
	 * @param arangoDbUtilities Utilities for accessing ArangoDB
	 * @param graph             ArangoDB graph in which to insert the documents
	 * @param documents         Documents to insert
	 */
	public static void insertDocuments(ArangoDbUtilities arangoDbUtilities, ArangoGraph graph,
			GraphDocuments documents) {
		long startTime = System.nanoTime();
		for (Map.Entry<String, Map<String, BaseDocument>> entry : documents.vertexDocuments.entrySet()) {
			ArangoVertexCollection vertexCollection = arangoDbUtilities.createOrGetVertexCollection(graph,
					entry.getKey());
			for (BaseDocument doc : entry.getValue().values()) {
				if (vertexCollection.getVertex(doc.getKey(), BaseDocument.class) == null) {
					vertexCollection.insertVertex(doc);
				} else {
					vertexCollection.updateVertex(doc.getKey(), doc);
				}
			}
		}
		for (Map.Entry<String, Map<String, BaseEdgeDocument>> entry : documents.edgeDocuments.entrySet()) {
			String[] names = entry.getKey().split("-");
			ArangoEdgeCollection edgeCollection = arangoDbUtilities.createOrGetEdgeCollection(graph, names[0],
					names[1]);
			for (BaseEdgeDocument doc : entry.getValue().values()) {
				if (edgeCollection.getEdge(doc.getKey(), BaseEdgeDocument.class) == null) {
					edgeCollection.insertEdge(doc);
				} else {
					edgeCollection.updateEdge(doc.getKey(), doc);
				}
			}
		}
		long stopTime = System.nanoTime();
		LOGGER.info("Inserted {} vertices, and {} edges in {} s", documents.countVertices(), documents.countEdges(),
				(stopTime - startTime) / 1e9);
	}

	/**
	 * Convert each SBGN-ML file in a directory, and load the graph descriptions
	 * into a local ArangoDB server instance.
	 *
	 * @param args Optional SBGN-ML directory, database name, graph name, and
	 *             ontology directory
	 */
	public static void main(String[] args) {
		Path inputDir = args.length > 0 ? Paths.get(args[0]) : SbgnConverter.sbgnDir;
		String databaseName = args.length > 1 ? args[1] : "Cell-KN-Pathways";
		String graphName = args.length > 2 ? args[2] : "KN-Pathways-v1.0";
		Path owlDir = args.length > 3 ? Paths.get(args[3]) : SbgnConverter.oboDir;

		List<Path> sbgnFiles;
		try {
			sbgnFiles = listFilesMatchingPattern(inputDir.toString(), SbgnConverter.SBGN_PATTERN);
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
		if (sbgnFiles.isEmpty()) {
			LOGGER.warn("No SBGN-ML files found matching the pattern {} in {}", SbgnConverter.SBGN_PATTERN, inputDir);
			System.exit(1);
		}

		// Convert the maps, and construct the documents
		SbgnMapParser parser = new SbgnMapParser(SbgnConverter.createGroundingService(owlDir));
		GraphDocuments documents = new GraphDocuments();
		SbgnConverter.parseSbgnFiles(sbgnFiles, parser)
				.forEach((mapName, result) -> constructDocuments(mapName, result, documents));

		// Always recreate the database, and graph
		ArangoDbUtilities arangoDbUtilities = new ArangoDbUtilities();
		arangoDbUtilities.deleteDatabase(databaseName);
		ArangoDatabase db = arangoDbUtilities.createOrGetDatabase(databaseName);
		ArangoGraph graph = arangoDbUtilities.createOrGetGraph(db, graphName);
		insertDocuments(arangoDbUtilities, graph, documents);

		arangoDbUtilities.arangoDB.shutdown();
	}
}
