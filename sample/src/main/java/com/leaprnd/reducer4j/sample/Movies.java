package com.leaprnd.reducer4j.sample;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static java.util.Collections.shuffle;
import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.toUnmodifiableSet;

public final class Movies {

	private Movies() {}

	/**
	 * @return The provided movies, each selected if and only if a movie with the
	 *         same id is selected among the previous movies.
	 */
	public static List<Movie> copySelectionFrom(List<Movie> movies, List<Movie> previousMovies) {
		final var selectedIds = previousMovies.stream().filter(Movie::isSelected).map(Movie::id).collect(toUnmodifiableSet());
		return movies.stream().map(movie -> movie.withSelected(selectedIds.contains(movie.id()))).toList();
	}

	public static List<Movie> toggleSelection(List<Movie> movies, int movieId) {
		return movies.stream().map(movie -> movie.id() == movieId ? movie.withSelected(!movie.isSelected()) : movie).toList();
	}

	/**
	 * @return A new list holding a random permutation of the provided movies.
	 */
	public static List<Movie> shuffled(List<Movie> movies, Random random) {
		final var newMovies = new ArrayList<>(movies);
		shuffle(newMovies, random);
		return unmodifiableList(newMovies);
	}

}
