package work.blocks.ast.catalogue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BlockCatalogueTest {
    @Test
    void loadsDefinitionsAndKeepsWarnings() {
        var catalogue = BlockCatalogue.load(Path.of("src", "test", "resources", "catalogue", "blocks.jsonl"));

        assertEquals(8, catalogue.size());
        assertEquals(new BlockDefinition("sum", "function", 2), catalogue.find("sum").orElseThrow());
        assertEquals("flow", catalogue.find("break").orElseThrow().kind());
        assertEquals("clamp", catalogue.find("forever").orElseThrow().kind());
        assertFalse(catalogue.find("break").orElseThrow().hasArity());
        assertFalse(catalogue.find("wobble").isPresent());

        assertEquals(3, catalogue.warnings().size());
        assertTrue(catalogue.warnings().get(0).contains("blocks.jsonl:10"));
        assertTrue(catalogue.warnings().get(1).contains("unsupported kind \"gadget\""));
        assertTrue(catalogue.warnings().get(2).contains("missing \"name\""));
    }

    @Test
    void parsesInlineContent() {
        var catalogue = BlockCatalogue.parse("""
            {"name": "print", "kind": "flow", "arity": 1}
            {"name": "print", "kind": "flow", "arity": -2}
            {"name": "print", "kind": "FLOW"}
            null
            {"name": "sum", "kind": "function", "arity": 2.5}
            {"name": "sum", "kind": "function", "arity": 4294967298}
            """);

        assertEquals(1, catalogue.size());
        assertFalse(catalogue.find("print").orElseThrow().hasArity());
        assertFalse(catalogue.find("sum").isPresent());
        assertEquals(5, catalogue.warnings().size());
        assertTrue(catalogue.warnings().get(0).contains("invalid arity"));
        assertTrue(catalogue.warnings().get(1).contains("more than once"));
        assertTrue(catalogue.warnings().get(2).contains("<inline>:4 is not an object"));
        assertTrue(catalogue.warnings().get(3).contains("invalid arity 2.5"));
        assertTrue(catalogue.warnings().get(4).contains("invalid arity 4294967298"));
    }

    @Test
    void buildsFromDefinitions() {
        var catalogue = BlockCatalogue.of(List.of(
            new BlockDefinition("repeat", "clamp-no-args", null),
            new BlockDefinition("pi", "value", null)
        ));

        assertEquals("clamp", catalogue.find("repeat").orElseThrow().kind());
        assertEquals("value", catalogue.find("pi").orElseThrow().kind());
        assertTrue(catalogue.warnings().isEmpty());
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        assertThrows(IllegalStateException.class, () -> BlockCatalogue.load(dir.resolve("absent.jsonl")));
    }

    @Test
    void negativeArityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BlockDefinition("sum", "function", -1));
    }
}
