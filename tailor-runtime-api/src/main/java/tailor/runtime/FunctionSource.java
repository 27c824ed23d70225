package tailor.runtime;

import java.util.Objects;

/**
 * 函数定义的原始源码片段（含文档注释与注解）以及它在所属文件中的位置
 */
public final class FunctionSource {
    private final String text;
    private final String fileName;
    private final int firstLine;

    /**
     * @param firstLine 片段第一行在所属文件中的行号（从 1 开始）
     */
    public FunctionSource(String text, String fileName, int firstLine) {
        this.text = Objects.requireNonNull(text, "text");
        this.fileName = fileName != null ? fileName : "<unknown>";
        this.firstLine = firstLine > 0 ? firstLine : 1;
    }

    public String getText() {
        return text;
    }

    public String getFileName() {
        return fileName;
    }

    public int getFirstLine() {
        return firstLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSource)) return false;
        FunctionSource that = (FunctionSource) o;
        return firstLine == that.firstLine && text.equals(that.text) && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, fileName, firstLine);
    }

    @Override
    public String toString() {
        return fileName + ":" + firstLine;
    }
}
