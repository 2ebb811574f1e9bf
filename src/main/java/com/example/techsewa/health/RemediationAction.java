package com.example.techsewa.health;

/**
 * One opaque fix attempt.  May throw; {@link AutoHealer} turns any failure into {@code false}.
 */
@FunctionalInterface
public interface RemediationAction {

    boolean run() throws Exception;
}
