package com.updown.position;

public enum WindowResult {
	NO_SIGNAL,
	WIN,
	LOSS,
	CLOSED,
	UNRESOLVED
}
