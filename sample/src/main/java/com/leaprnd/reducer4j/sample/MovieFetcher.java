package com.leaprnd.reducer4j.sample;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface MovieFetcher {
	CompletableFuture<List<Movie>> fetch();
}
