package io.github.yok.deploykit.service;

/**
 * The parts of {@link Runtime} the shutdown handling touches.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ProcessControl {

    void addShutdownHook(Thread hook);

    /**
     * Removes a hook.
     *
     * @param hook hook added earlier
     * @return {@code true} when it was registered
     * @throws IllegalStateException when the JVM is already shutting down
     */
    boolean removeShutdownHook(Thread hook);

    /**
     * Terminates the JVM immediately with the given status, without running further hooks.
     *
     * @param status exit status
     */
    void halt(int status);

    /**
     * Returns the control backed by the current {@link Runtime}.
     *
     * @return process control
     */
    static ProcessControl runtime() {
        return new ProcessControl() {
            @Override
            public void addShutdownHook(Thread hook) {
                Runtime.getRuntime().addShutdownHook(hook);
            }

            @Override
            public boolean removeShutdownHook(Thread hook) {
                return Runtime.getRuntime().removeShutdownHook(hook);
            }

            @Override
            public void halt(int status) {
                Runtime.getRuntime().halt(status);
            }
        };
    }
}
