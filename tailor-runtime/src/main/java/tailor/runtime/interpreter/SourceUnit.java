package tailor.runtime.interpreter;

import java.util.Objects;

/**
 * 一段被解析过的源码。AST 节点上的偏移量指向这段文本。
 */
public final class SourceUnit {
    private final String text;
    private final String fileName;

    public SourceUnit(String text, String fileName) {
        this.text = Objects.requireNonNull(text, "text");
        this.fileName = fileName != null ? fileName : "<unknown>";
    }

    public String getText() {
        return text;
    }

    public String getFileName() {
        return fileName;
    }

    String slice(int start, int end) {
        return text.substring(start, end);
    }

    /** [from, to) 之间的换行数 */
    int countNewlines(int from, int to) {
        int count = 0;
        for (int i = from; i < to && i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }
}
