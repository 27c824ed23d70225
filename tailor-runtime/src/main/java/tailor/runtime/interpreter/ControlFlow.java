package tailor.runtime.interpreter;

/**
 * 控制流异常
 *
 * <p>用于实现 return、break、continue。不是错误，脚本中的 try/catch 不会捕获它。</p>
 */
public final class ControlFlow extends RuntimeException {

    public enum Type {
        RETURN,
        BREAK,
        CONTINUE
    }

    private final Type type;
    private final Object value;

    private ControlFlow(Type type, Object value) {
        super(null, null, false, false);  // 禁用堆栈跟踪
        this.type = type;
        this.value = value;
    }

    public Type getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    /** 对应的关键字，用于错误消息 */
    String keyword() {
        switch (type) {
            case BREAK: return "break";
            case CONTINUE: return "continue";
            default: return "return";
        }
    }

    // ============ 工厂方法 ============

    public static ControlFlow returnValue(Object value) {
        return new ControlFlow(Type.RETURN, value);
    }

    public static ControlFlow breakLoop() {
        return new ControlFlow(Type.BREAK, null);
    }

    public static ControlFlow continueLoop() {
        return new ControlFlow(Type.CONTINUE, null);
    }
}
