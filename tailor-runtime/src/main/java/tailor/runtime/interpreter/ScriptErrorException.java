package tailor.runtime.interpreter;

import com.tailor.compiler.ast.SourceLocation;

/**
 * 携带脚本错误值的异常
 *
 * <p>脚本内可被 catch 捕获；逃出脚本函数后原样传给 Java 调用方。</p>
 */
public class ScriptErrorException extends TailorRuntimeException {

    private final ScriptError error;

    public ScriptErrorException(ScriptError error) {
        super(error.toString());
        this.error = error;
    }

    public ScriptErrorException(ScriptError error, SourceLocation location) {
        super(error.toString(), location);
        this.error = error;
    }

    public ScriptError getError() {
        return error;
    }

    public ErrorType getErrorType() {
        return error.getType();
    }

    /** 错误值自身的消息（不含类型名） */
    public String getErrorMessage() {
        return error.getMessage();
    }
}
