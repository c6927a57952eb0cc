package com.leaprnd.reducer4j.sample;

import java.util.List;

import static java.util.Objects.requireNonNull;

public record MoviesListState(boolean isLoading, String title, List<Movie> movies) {

	public static final MoviesListState INITIAL = new MoviesListState(false, "IMDb\nTop 10 Movies", List.of());

	public MoviesListState {
		requireNonNull(title);
		requireNonNull(movies);
	}

	public MoviesListState withLoading(boolean newIsLoading) {
		return new MoviesListState(newIsLoading, title, movies);
	}

	public MoviesListState withMovies(List<Movie> newMovies) {
		return new MoviesListState(isLoading, title, newMovies);
	}

}
