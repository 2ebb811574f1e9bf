package com.example.techsewa.health;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an OS command and reports its exit status.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @return the exit code
     * @throws IOException when the command cannot be started or does not finish in time
     */
    int run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
