package tailor.runtime.materialize;

import com.tailor.compiler.transform.ResultBindingNamer;

import java.io.PrintStream;

/**
 * 改写引擎与运行时的配置，不可变。通过 {@link #builder()} 构造。
 */
public final class EngineOptions {

    public static final int DEFAULT_CACHE_SIZE = 256;

    private static final EngineOptions DEFAULTS = builder().build();

    private final String resultBaseName;
    private final int cacheSize;
    private final boolean stripAnnotations;
    private final PrintStream output;

    private EngineOptions(Builder builder) {
        this.resultBaseName = builder.resultBaseName;
        this.cacheSize = builder.cacheSize;
        this.stripAnnotations = builder.stripAnnotations;
        this.output = builder.output;
    }

    public static EngineOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 结果绑定的基础名，冲突时追加 _1、_2 ... */
    public String getResultBaseName() {
        return resultBaseName;
    }

    /** 改写结果缓存的最大条目数，0 表示不缓存 */
    public int getCacheSize() {
        return cacheSize;
    }

    /** 改写前是否去掉定义上的注解 */
    public boolean isStripAnnotations() {
        return stripAnnotations;
    }

    /** print 的输出目标 */
    public PrintStream getOutput() {
        return output;
    }

    public static final class Builder {
        private String resultBaseName = ResultBindingNamer.DEFAULT_BASE_NAME;
        private int cacheSize = DEFAULT_CACHE_SIZE;
        private boolean stripAnnotations = true;
        private PrintStream output = System.out;

        private Builder() {
        }

        public Builder resultBaseName(String resultBaseName) {
            if (resultBaseName == null || resultBaseName.isEmpty()) {
                throw new IllegalArgumentException("resultBaseName must not be empty");
            }
            this.resultBaseName = resultBaseName;
            return this;
        }

        public Builder cacheSize(int cacheSize) {
            if (cacheSize < 0) {
                throw new IllegalArgumentException("cacheSize must not be negative");
            }
            this.cacheSize = cacheSize;
            return this;
        }

        public Builder stripAnnotations(boolean stripAnnotations) {
            this.stripAnnotations = stripAnnotations;
            return this;
        }

        public Builder output(PrintStream output) {
            if (output == null) {
                throw new IllegalArgumentException("output must not be null");
            }
            this.output = output;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
