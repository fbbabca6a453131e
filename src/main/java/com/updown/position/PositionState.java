package com.updown.position;

public enum PositionState {
	FLAT,
	PENDING_ENTRY,
	OPEN,
	PENDING_CLOSE,
	CLOSED
}
