package work.blocks.ast.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DiagnosticLevelTest {
    @Test
    void parsesCaseInsensitively() {
        assertEquals(DiagnosticLevel.DEBUG, DiagnosticLevel.from("debug"));
        assertEquals(DiagnosticLevel.INFO, DiagnosticLevel.from(" Info "));
        assertEquals(DiagnosticLevel.OFF, DiagnosticLevel.from("OFF"));
    }

    @Test
    void defaultsToWarn() {
        assertEquals(DiagnosticLevel.WARN, DiagnosticLevel.from(null));
        assertEquals(DiagnosticLevel.WARN, DiagnosticLevel.from("  "));
        assertEquals(DiagnosticLevel.DEFAULT, AstSettings.defaults().diagnosticLevel());
    }

    @Test
    void rejectsUnknownLevels() {
        var error = assertThrows(IllegalArgumentException.class, () -> DiagnosticLevel.from(" verbose "));
        assertEquals("Unknown diagnostics level \"verbose\" (expected off, debug, info or warn)", error.getMessage());
    }
}
