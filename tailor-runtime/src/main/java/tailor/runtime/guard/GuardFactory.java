package tailor.runtime.guard;

/**
 * 守卫工厂：由配置参数构造守卫，可注册到 {@link GuardRegistry}
 */
@FunctionalInterface
public interface GuardFactory {

    Guard create(Object... config);
}
