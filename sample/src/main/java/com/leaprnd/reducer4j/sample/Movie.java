package com.leaprnd.reducer4j.sample;

import static java.util.Objects.requireNonNull;

public record Movie(int id, String name, String imageUrl, boolean isSelected) {

	public Movie {
		requireNonNull(name);
		requireNonNull(imageUrl);
	}

	public Movie(int id, String name, String imageUrl) {
		this(id, name, imageUrl, false);
	}

	public Movie withSelected(boolean newIsSelected) {
		return new Movie(id, name, imageUrl, newIsSelected);
	}

}
