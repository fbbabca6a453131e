package com.updown.position;

public record EntryOutcome(boolean filled, Position position, String rejectReason) {

	static EntryOutcome filled(Position position) {
		return new EntryOutcome(true, position, null);
	}

	static EntryOutcome rejected(String reason) {
		return new EntryOutcome(false, null, reason);
	}
}
