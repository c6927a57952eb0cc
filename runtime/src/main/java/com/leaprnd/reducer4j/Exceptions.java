package com.leaprnd.reducer4j;

final class Exceptions {

	private Exceptions() {}

	@SuppressWarnings("unchecked")
	public static <T extends Throwable> RuntimeException unchecked(Throwable toThrow) throws T {
		throw (T) toThrow;
	}

	public static int requirePositive(int value, String name) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be positive but was " + value + "!");
		}
		return value;
	}

}
