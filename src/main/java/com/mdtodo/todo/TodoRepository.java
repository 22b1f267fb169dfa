package com.mdtodo.todo;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TodoRepository {

    /** Inserts or replaces the todo with the same id. Throws {@link TodoValidationException} for an invalid todo. */
    Todo save(Todo todo);

    /** Newest first by {@code createdAt}. */
    List<Todo> findAll();

    Optional<Todo> findById(UUID id);

    /**
     * Loads, applies {@code update} via {@link Todo#apply(TodoUpdate)} and stores the result as one
     * atomic step. Empty when no todo has this id; a {@link TodoValidationException} leaves the
     * stored todo untouched.
     */
    Optional<Todo> update(UUID id, TodoUpdate update);

    boolean deleteById(UUID id);
}
