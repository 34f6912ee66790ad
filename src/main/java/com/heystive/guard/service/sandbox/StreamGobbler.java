package com.heystive.guard.service.sandbox;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Drains a child process stream into a capped buffer. Once the cap is reached the rest of
 * the stream is still read so the child never blocks on a full pipe.
 */
final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuffer sink = new StringBuffer();
    private final String name;
    private final int maxChars;

    StreamGobbler(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    private Thread thread;

    static StreamGobbler start(InputStream inputStream, String name, int maxChars) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, name, maxChars);
        gobbler.thread = new Thread(gobbler, name);
        gobbler.thread.setDaemon(true);
        gobbler.thread.start();
        return gobbler;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (capReached) {
                    continue;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = maxChars - sink.length();
                if (line.length() > available) {
                    sink.append(line, 0, Math.max(0, available));
                    LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                    capReached = true;
                } else {
                    sink.append(line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /**
     * Waits up to {@code timeout} for the stream to reach end of file.
     */
    void join(Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    String content() {
        return sink.toString();
    }
}
