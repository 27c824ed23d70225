package tailor.runtime.interpreter;

import com.tailor.compiler.ast.SourceLocation;
import tailor.runtime.TailorException;

/**
 * Tailor 运行时异常
 *
 * <p>携带出错位置。位置在异常向外传播时由解释器补上，只记录最内层的一次。</p>
 */
public class TailorRuntimeException extends TailorException {

    private SourceLocation location;

    public TailorRuntimeException(String message) {
        super(message);
    }

    public TailorRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TailorRuntimeException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    void attachLocation(SourceLocation where) {
        if (location == null && where != null && where.getLine() > 0) {
            this.location = where;
        }
    }

    /** 返回不含位置信息的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (location == null || location.getLine() <= 0) {
            return super.getMessage();
        }
        return super.getMessage() + "\n  --> " + location;
    }
}
