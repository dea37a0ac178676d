package io.github.cyfko.algezip.core.exception;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Tests")
public class ExceptionMessagesTest {

    @Test
    @DisplayName("Syntax exception keeps message and cause")
    void syntaxExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        ExpressionSyntaxException ex = new ExpressionSyntaxException("bad input", cause);

        assertEquals("bad input", ex.getMessage());
        assertSame(cause, ex.getCause());
        assertInstanceOf(RuntimeException.class, ex);
    }

    @Test
    @DisplayName("Navigation exception exposes its reason")
    void navigationExceptionReason() {
        NavigationException ex = new NavigationException(NavigationException.Reason.AT_ROOT, "at top");

        assertEquals(NavigationException.Reason.AT_ROOT, ex.getReason());
        assertEquals("at top", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("notApplicable lists one transformation per line")
    void notApplicableMessage() {
        RuleApplicationException ex = RuleApplicationException.notApplicable(
                "factor", List.of("x -> y", "y -> x"));

        assertEquals(RuleApplicationException.Reason.NOT_APPLICABLE, ex.getReason());
        assertEquals("cannot factor -- valid transformations are:\nx -> y\ny -> x", ex.getMessage());
    }

    @Test
    @DisplayName("Rule exception keeps its cause")
    void ruleExceptionKeepsCause() {
        Exception cause = new Exception("root");
        RuleApplicationException ex = new RuleApplicationException(
                RuleApplicationException.Reason.INVALID_ARGUMENT, "no argument", cause);

        assertEquals(RuleApplicationException.Reason.INVALID_ARGUMENT, ex.getReason());
        assertSame(cause, ex.getCause());
    }
}
