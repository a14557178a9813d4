package org.background.task.engine.core.processor;

/**
 * One named sub-step of a staged payload and the progress reached once it is done.
 */
public record PayloadStep(double progress, String message) {
}
