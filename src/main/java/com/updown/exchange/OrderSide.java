package com.updown.exchange;

public enum OrderSide {
	BUY,
	SELL
}
