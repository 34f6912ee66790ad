package com.heystive.guard.service.sandbox;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the sandbox can be tested without spawning
 * real processes. Production code uses {@link DefaultProcessFactory}.
 */
interface ProcessFactory {
    /**
     * Starts a process with an explicit argument vector. No shell is involved.
     *
     * @param command executable followed by its arguments
     * @param workingDir working directory (null for the caller's directory)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
