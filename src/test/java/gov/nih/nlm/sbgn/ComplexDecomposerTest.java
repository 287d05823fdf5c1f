package gov.nih.nlm.sbgn;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComplexDecomposerTest {

    @Test
    void decomposeComplexLabel_modificationsAndNucleotide() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("TBK1-P:IKBKE-ubq:GTP");

        assertEquals(List.of("TBK1", "IKBKE", "GTP"), List.copyOf(components.keySet()));
        assertEquals(new ComplexComponent(new EntityReference("hgnc", "11584", "TBK1"),
                ModificationTag.PHOSPHORYLATION), components.get("TBK1"));
        assertEquals(new ComplexComponent(new EntityReference("hgnc", "14552", "IKBKE"),
                ModificationTag.UBIQUITINATION), components.get("IKBKE"));
        assertEquals(new ComplexComponent(new EntityReference("chebi", "15996", "GTP"), null),
                components.get("GTP"));
    }

    @Test
    void decomposeComplexLabel_plainSymbols() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("TP53:MAPK1");

        assertEquals(new EntityReference("hgnc", "11998", "TP53"), components.get("TP53").entity());
        assertEquals(new EntityReference("hgnc", "6871", "MAPK1"), components.get("MAPK1").entity());
        assertNull(components.get("TP53").tag());
    }

    @Test
    void decomposeComplexLabel_allNucleotidesUseChebi() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("ATP:ADP:GDP");

        assertEquals(new EntityReference("chebi", "15422", "ATP"), components.get("ATP").entity());
        assertEquals(new EntityReference("chebi", "16761", "ADP"), components.get("ADP").entity());
        assertEquals(new EntityReference("chebi", "17552", "GDP"), components.get("GDP").entity());
    }

    @Test
    void decomposeComplexLabel_paralogFamilyIsUnknown() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("RAB5*:TBK1");

        ComplexComponent family = components.get("RAB5*");
        assertEquals(EntityReference.UNKNOWN, family.entity().prefix());
        assertEquals(EntityReference.UNKNOWN, family.entity().identifier());
        assertEquals("RAB5*", family.entity().name());
        assertNull(family.tag());
    }

    @Test
    void decomposeComplexLabel_modificationRuleTakesPrecedence() {
        // The remainder after stripping the suffix is looked up in HGNC, even for a nucleotide
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("ATP-P");

        ComplexComponent component = components.get("ATP");
        assertEquals(ModificationTag.PHOSPHORYLATION, component.tag());
        assertFalse(component.entity().isGrounded());
    }

    @Test
    void decomposeComplexLabel_lookupMissIsUngrounded() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("NOTAGENE-ubq");

        ComplexComponent component = components.get("NOTAGENE");
        assertEquals(EntityReference.ungrounded("NOTAGENE"), component.entity());
        assertEquals(ModificationTag.UBIQUITINATION, component.tag());
    }

    @Test
    void decomposeComplexLabel_empty() {
        assertTrue(ComplexDecomposer.decomposeComplexLabel("").isEmpty());
    }

    @Test
    void decomposeComplexLabel_repeatedConstituentKeepsOneEntry() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("TP53:TP53-P");

        assertEquals(1, components.size());
        assertEquals(ModificationTag.PHOSPHORYLATION, components.get("TP53").tag());
    }

    @Test
    void decomposeComplexLabel_trailingEmptyConstituentKept() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel("TP53:");

        assertEquals(List.of("TP53", ""), List.copyOf(components.keySet()));
        assertEquals(EntityReference.ungrounded(""), components.get("").entity());
        assertNull(components.get("").tag());
    }

    @Test
    void decomposeComplexLabel_colonOnly() {
        Map<String, ComplexComponent> components = ComplexDecomposer.decomposeComplexLabel(":");

        assertEquals(List.of(""), List.copyOf(components.keySet()));
    }
}
