package dev.taskgate.dto.request;

/**
 * Reply to a task waiting for input.
 */
public record TaskInputRequest(String input) {}
