package com.updown.position;

public record CloseOutcome(boolean closed, Position position, String failureReason) {
}
