package tailor.runtime.guard;

import tailor.runtime.TailorException;

/**
 * 注册表中找不到指定守卫
 */
public class GuardNotFoundException extends TailorException {

    public GuardNotFoundException(String name, String namespace) {
        super(namespace == null
                ? "Guard '" + name + "' is not registered in global namespace"
                : "Guard '" + name + "' is not registered in namespace '" + namespace + "'");
    }
}
