package tailor.runtime.guard;

import tailor.runtime.TailorException;

/**
 * 守卫失败时默认抛出的异常
 */
public class GuardClauseError extends TailorException {

    public GuardClauseError(String message) {
        super(message);
    }
}
