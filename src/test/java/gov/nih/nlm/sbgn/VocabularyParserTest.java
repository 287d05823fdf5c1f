package gov.nih.nlm.sbgn;

import org.apache.jena.graph.NodeFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VocabularyParserTest {

    private static final Path testOboDir = Paths.get(System.getProperty("user.dir")).resolve("src/test/data/obo");
    private static Map<String, Vocabulary> vocabularies;

    @BeforeAll
    static void setUp() {
        vocabularies = VocabularyParser.parseVocabularies(List.of(testOboDir.resolve("vocabulary-test.owl")));
    }

    // --- parseTermId tests ---

    @Test
    void parseTermId_oboPurl() {
        assertEquals(new VocabularyParser.TermId("go", "0005737"),
                VocabularyParser.parseTermId(NodeFactory.createURI("http://purl.obolibrary.org/obo/GO_0005737")));
    }

    @Test
    void parseTermId_efoIri() {
        assertEquals(new VocabularyParser.TermId("efo", "0000400"),
                VocabularyParser.parseTermId(NodeFactory.createURI("http://www.ebi.ac.uk/efo/EFO_0000400")));
    }

    @Test
    void parseTermId_notATerm() {
        assertNull(VocabularyParser.parseTermId(NodeFactory.createURI("http://purl.obolibrary.org/obo/go.owl")));
        assertNull(VocabularyParser.parseTermId(NodeFactory.createBlankNode()));
    }

    // --- parseVocabularyFile tests ---

    @Test
    void parseVocabularyFile_prefixes() {
        assertEquals(3, vocabularies.get("go").size());
        assertEquals(1, vocabularies.get("efo").size());
        assertEquals(1, vocabularies.get("chebi").size());
    }

    @Test
    void parseVocabularyFile_obsoleteTermsSkipped() {
        assertFalse(vocabularies.get("go").labels.containsKey("0005623"));
        assertNull(vocabularies.get("go").findTerm("obsolete cell"));
    }

    @Test
    void parseVocabularyFile_labelWinsOverSynonym() {
        // "cytoplasm" is also an exact synonym of inflammatory response
        assertEquals(new Grounding("go", "0005737", "cytoplasm"), vocabularies.get("go").findTerm("cytoplasm"));
    }

    @Test
    void parseVocabularyFile_exactSynonym() {
        assertEquals(new Grounding("go", "0005737", "cytoplasm"),
                vocabularies.get("go").findTerm("Cytosol and organelles"));
        assertEquals(new Grounding("chebi", "15422", "ATP"),
                vocabularies.get("chebi").findTerm("adenosine 5'-triphosphate"));
    }

    @Test
    void parseVocabularyFile_addsToExistingVocabulary() {
        Map<String, Vocabulary> seeded = new HashMap<>();
        seeded.put("chebi", VocabularyParser.createVocabulary("chebi", Map.of("GTP", "15996")));
        VocabularyParser.parseVocabularyFile(testOboDir.resolve("vocabulary-test.owl"), seeded);

        assertEquals(2, seeded.get("chebi").size());
        assertNotNull(seeded.get("chebi").findTerm("GTP"));
        assertNotNull(seeded.get("chebi").findTerm("ATP"));
    }

    // --- Vocabulary tests ---

    @Test
    void findTerm_ignoresCaseAndSurroundingWhiteSpace() {
        Vocabulary vocabulary = VocabularyParser.createVocabulary("HGNC", Map.of("TP53", "11998"));
        assertEquals("hgnc", vocabulary.prefix);
        assertEquals(new Grounding("hgnc", "11998", "TP53"), vocabulary.findTerm("  tp53 "));
        assertNull(vocabulary.findTerm("TP5"));
    }
}
