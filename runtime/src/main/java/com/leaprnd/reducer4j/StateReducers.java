package com.leaprnd.reducer4j;

import static com.leaprnd.reducer4j.StateReducerOptions.defaults;

public final class StateReducers {

	private StateReducers() {}

	public static <S, E> StateReducer<S, E> create(S initialState, Reducer<S, E> reducer, Scope scope) {
		return create(initialState, reducer, scope, defaults());
	}

	public static <S, E> StateReducer<S, E> create(
		S initialState,
		Reducer<S, E> reducer,
		Scope scope,
		StateReducerOptions options
	) {
		return new DefaultStateReducer<>(initialState, reducer, scope, options);
	}

}
