package com.solverhub.process;

import java.io.IOException;
import java.util.List;

/**
 * Starts external processes. Swappable so tests can script exit codes.
 */
public interface ProcessLauncher {

    /**
     * Start a process.
     *
     * @param command Executable followed by its arguments
     * @return Handle on the started process
     * @throws IOException if the process could not be started
     */
    RunningProcess start(List<String> command) throws IOException;
}
