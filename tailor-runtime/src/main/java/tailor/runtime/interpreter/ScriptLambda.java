package tailor.runtime.interpreter;

import com.tailor.compiler.ast.decl.Parameter;
import com.tailor.compiler.ast.stmt.Block;
import tailor.runtime.Arguments;
import tailor.runtime.FunctionSignature;
import tailor.runtime.TailorCallable;

import java.util.List;

/**
 * lambda（{ a -> ... }）与匿名函数（fun(a) { ... }）
 *
 * <p>lambda 以最后一个表达式为值；匿名函数只通过 return 返回值。
 * 两者内部的 return 都只从自身返回。没有源码，不能做隐式返回改写。</p>
 */
public final class ScriptLambda implements TailorCallable {
    private final List<Parameter> params;
    private final Block body;
    private final Environment closure;
    private final Interpreter interpreter;
    private final boolean anonymousFunction;
    private final FunctionSignature signature;

    ScriptLambda(List<Parameter> params, Block body, Environment closure, Interpreter interpreter,
                 boolean anonymousFunction) {
        this.params = params;
        this.body = body;
        this.closure = closure;
        this.interpreter = interpreter;
        this.anonymousFunction = anonymousFunction;
        this.signature = ScriptFunction.signatureOf(getName(), params, null);
    }

    @Override
    public String getName() {
        return anonymousFunction ? "<anonymous>" : "<lambda>";
    }

    @Override
    public Object call(Arguments args) {
        return interpreter.callLambda(this, args);
    }

    @Override
    public FunctionSignature getSignature() {
        return signature;
    }

    List<Parameter> getParams() {
        return params;
    }

    Block getBody() {
        return body;
    }

    Environment getClosure() {
        return closure;
    }

    boolean isAnonymousFunction() {
        return anonymousFunction;
    }

    @Override
    public String toString() {
        return getName();
    }
}
