package com.heystive.guard.service.sandbox;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Fake processes for sandbox tests, so no real executable is spawned.
 */
final class SandboxTestDoubles {

    private SandboxTestDoubles() {}

    /**
     * @param stdout stdout content
     * @param stderr stderr content
     * @param exitCode exit code reported once finished
     * @param finishAfterMillis delay before the process finishes (-1 means it never does on its own)
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior exits(int exitCode, String stdout, String stderr) {
            return new ProcessBehavior(stdout, stderr, exitCode, 0);
        }

        static ProcessBehavior hangs() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /** Callback run inside {@link StubProcessFactory#start}, while the payload file still exists. */
    @FunctionalInterface
    interface StartHook {
        void onStart(List<String> command, Path workingDir) throws IOException;
    }

    /**
     * Returns a pre-configured process and remembers how it was started.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process process;
        private final StartHook hook;
        private volatile List<String> lastCommand;
        private volatile Path lastWorkingDir;
        private volatile int starts;

        StubProcessFactory(Process process) {
            this(process, (command, dir) -> { });
        }

        StubProcessFactory(Process process, StartHook hook) {
            this.process = process;
            this.hook = hook;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            starts++;
            lastCommand = List.copyOf(command);
            lastWorkingDir = workingDir;
            hook.onStart(command, workingDir);
            return process;
        }

        List<String> lastCommand() {
            return lastCommand;
        }

        Path lastWorkingDir() {
            return lastWorkingDir;
        }

        Path lastPayloadFile() {
            return Path.of(lastCommand.get(lastCommand.size() - 1));
        }

        int starts() {
            return starts;
        }
    }

    /**
     * Process with scripted output, exit code and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled;
        private volatile List<ProcessHandle> descendants;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                alive = false;
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        /** Reports the given handles as descendants; without this, {@link #descendants()} is unsupported. */
        TestProcess withDescendants(ProcessHandle... handles) {
            this.descendants = List.of(handles);
            return this;
        }

        @Override
        public Stream<ProcessHandle> descendants() {
            List<ProcessHandle> handles = descendants;
            return handles == null ? super.descendants() : handles.stream();
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis >= 0 && finishAfterMillis <= ms) {
                Thread.sleep(finishAfterMillis);
                alive = false;
                return true;
            }
            Thread.sleep(ms);
            return !alive;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
