package com.phillippitts.mediaqueue.service.runner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Copies a process stream into a buffer until a cap is reached, then keeps draining without
 * accumulating so the child never blocks on a full pipe.
 */
final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuffer sink;
    private final String name;
    private final int maxChars;

    StreamGobbler(InputStream inputStream, StringBuffer sink, String name, int maxChars) {
        this.inputStream = inputStream;
        this.sink = sink;
        this.name = name;
        this.maxChars = maxChars;
    }

    static Thread start(InputStream inputStream, StringBuffer sink, String name, int maxChars) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxChars), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                if (sink.length() >= maxChars) {
                    if (!capReached) {
                        LOG.warn("Stream '{}' reached {} char cap; discarding further output", name, maxChars);
                        capReached = true;
                    }
                    continue;
                }
                if (sink.length() > 0) {
                    sink.append('\n');
                }
                int available = maxChars - sink.length();
                if (line.length() > available) {
                    sink.append(line, 0, Math.max(available, 0));
                    LOG.warn("Stream '{}' reached {} char cap (truncated line)", name, maxChars);
                    capReached = true;
                } else {
                    sink.append(line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }
}
