package com.tailor.compiler.formatter;

/**
 * 格式化输出缓冲：按层级在每行开头补缩进
 */
final class FormatterContext {
    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int depth;
    private boolean lineStart = true;

    FormatterContext(FormatConfig config) {
        this.indentUnit = config.getIndentUnit();
    }

    void indent() {
        depth++;
    }

    void dedent() {
        if (depth == 0) {
            throw new IllegalStateException("Unbalanced dedent");
        }
        depth--;
    }

    void append(String text) {
        if (text == null || text.length() == 0) return;
        if (lineStart) {
            for (int i = 0; i < depth; i++) {
                out.append(indentUnit);
            }
            lineStart = false;
        }
        out.append(text);
    }

    void newLine() {
        out.append('\n');
        lineStart = true;
    }

    String getOutput() {
        return out.toString();
    }
}
