package tailor.runtime;

/**
 * Tailor 基础运行时异常（无源位置信息）。
 *
 * <p>{@code tailor-runtime} 中的 {@code TailorRuntimeException} 继承此类，
 * 并添加 SourceLocation 等诊断信息。</p>
 */
public class TailorException extends RuntimeException {

    public TailorException(String message) {
        super(message);
    }

    public TailorException(String message, Throwable cause) {
        super(message, cause);
    }
}
