package io.github.cyfko.algezip.core.render;

/**
 * An expression line together with a marker line of the same length that has {@code ^}
 * under every character of the focused subexpression and spaces elsewhere.
 * <pre>
 * ([a | b] &amp; [!{a &amp; b}])
 *  ^^^^^^^
 * </pre>
 *
 * @param expression the rendered whole expression
 * @param marker     the focus marker line
 * @author AlgeZip contributors
 * @since 1.0
 */
public record FocusedRendering(String expression, String marker) {

    @Override
    public String toString() {
        return expression + System.lineSeparator() + marker;
    }
}
