package com.leaprnd.reducer4j.sample;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.leaprnd.reducer4j.sample.Movies.copySelectionFrom;
import static com.leaprnd.reducer4j.sample.Movies.shuffled;
import static com.leaprnd.reducer4j.sample.Movies.toggleSelection;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

public class MoviesTest {

	private static final Movie ALIEN = new Movie(1, "Alien", "alien.jpg");
	private static final Movie ALIENS = new Movie(2, "Aliens", "aliens.jpg");

	@Test
	public void testCopySelectionFromMatchesById() {
		final var previous = List.of(ALIEN.withSelected(true), ALIENS);
		final var fresh = List.of(ALIENS.withSelected(true), new Movie(1, "Alien (Director's Cut)", "alien.jpg"));
		assertEquals(
			List.of(ALIENS, new Movie(1, "Alien (Director's Cut)", "alien.jpg", true)),
			copySelectionFrom(fresh, previous)
		);
	}

	@Test
	public void testToggleSelectionOnlyTouchesTheMatchingId() {
		assertEquals(List.of(ALIEN.withSelected(true), ALIENS), toggleSelection(List.of(ALIEN, ALIENS), ALIEN.id()));
		assertEquals(List.of(ALIEN, ALIENS), toggleSelection(List.of(ALIEN, ALIENS), 3));
	}

	@Test
	public void testShuffledProducesANewList() {
		final var movies = List.of(ALIEN, ALIENS);
		final var shuffledMovies = shuffled(movies, new Random(7));
		assertNotSame(movies, shuffledMovies);
		assertEquals(2, shuffledMovies.size());
		assertEquals(List.of(ALIEN, ALIENS), movies);
	}

}
