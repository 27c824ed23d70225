package tailor.runtime.interpreter;

/**
 * 变量绑定。模块作用域的绑定会被多个线程读取，所以值是 volatile 的。
 *
 * <p>没有初始值的 {@code var} 处于未赋值状态，第一次赋值之前读取会报错。</p>
 */
final class Binding {
    private volatile Object value;
    private volatile boolean assigned;
    private final boolean mutable;

    Binding(Object value, boolean mutable) {
        this.value = value;
        this.mutable = mutable;
        this.assigned = true;
    }

    private Binding() {
        this.mutable = true;
    }

    static Binding unassigned() {
        return new Binding();
    }

    Object get() {
        return value;
    }

    void set(Object value) {
        this.value = value;
        this.assigned = true;
    }

    boolean isAssigned() {
        return assigned;
    }

    boolean isMutable() {
        return mutable;
    }
}
