package io.github.cyfko.algezip.core.model;

/**
 * Canonical text of an expression: {@code ()} brackets only, one space around {@code &} and {@code |}.
 */
final class CanonicalForm {

    private CanonicalForm() {}

    static String of(Expression expression) {
        StringBuilder out = new StringBuilder();
        append(expression, out);
        return out.toString();
    }

    private static void append(Expression expression, StringBuilder out) {
        if (expression instanceof Constant constant) {
            out.append(constant.symbol());
        } else if (expression instanceof Variable variable) {
            out.append(variable.name());
        } else if (expression instanceof Not not) {
            out.append("(!");
            append(not.operand(), out);
            out.append(')');
        } else if (expression instanceof BinaryExpression binary) {
            out.append('(');
            append(binary.left(), out);
            out.append(' ').append(binary.operator().symbol()).append(' ');
            append(binary.right(), out);
            out.append(')');
        }
    }
}
