package com.solverhub.process;

import java.time.Duration;
import java.util.List;

/**
 * Handle on a started process.
 */
public interface RunningProcess {

    List<String> command();

    /**
     * Wait for the process to exit.
     *
     * @param timeout Maximum wait; {@code null} waits without limit
     * @return Exit code and captured output; on timeout the process is killed
     *         and {@link ProcessResult#timedOut()} is set
     */
    ProcessResult await(Duration timeout) throws InterruptedException;

    boolean isAlive();

    /**
     * Forcibly terminate the process. No-op if it already exited.
     */
    void kill();
}
