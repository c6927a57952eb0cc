package com.leaprnd.reducer4j.sample;

public final class MoviesListRenderer {

	private MoviesListRenderer() {}

	public static String render(MoviesListState state) {
		final var builder = new StringBuilder();
		builder.append(state.title()).append('\n');
		if (state.isLoading()) {
			builder.append("(refreshing...)\n");
		}
		var position = 0;
		for (final var movie : state.movies()) {
			builder
				.append(++ position)
				.append(". ")
				.append(movie.isSelected() ? '*' : ' ')
				.append(' ')
				.append(movie.name())
				.append('\n');
		}
		return builder.toString();
	}

}
