package com.tailor.compiler.formatter;

/**
 * 格式化配置：缩进单位。不可变。
 */
public final class FormatConfig {
    private static final FormatConfig DEFAULT = spaces(4);

    private final String indentUnit;

    private FormatConfig(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /** 四个空格缩进 */
    public static FormatConfig defaults() {
        return DEFAULT;
    }

    public static FormatConfig spaces(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Indent width must be positive: " + width);
        }
        StringBuilder sb = new StringBuilder(width);
        for (int i = 0; i < width; i++) {
            sb.append(' ');
        }
        return new FormatConfig(sb.toString());
    }

    public static FormatConfig tabs() {
        return new FormatConfig("\t");
    }

    public String getIndentUnit() {
        return indentUnit;
    }
}
