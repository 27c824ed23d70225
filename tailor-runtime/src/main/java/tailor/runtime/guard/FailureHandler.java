package tailor.runtime.guard;

import tailor.runtime.Arguments;

/**
 * 守卫失败处理器，返回值作为本次调用的结果
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * @param message 失败守卫给出的消息
     * @param args    原始调用参数
     */
    Object handle(String message, Arguments args);
}
