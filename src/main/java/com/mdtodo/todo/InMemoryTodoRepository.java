package com.mdtodo.todo;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

@Repository
@ConditionalOnProperty(prefix = "todo.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTodoRepository implements TodoRepository {

    private static final Comparator<Todo> NEWEST_FIRST = Comparator.comparing(Todo::getCreatedAt).reversed();

    private final Map<UUID, Todo> store = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Todo save(Todo todo) {
        todo.validate();
        return withLock(lock.writeLock(), () -> {
            store.put(todo.getId(), todo.copy());
            return todo.copy();
        });
    }

    @Override
    public List<Todo> findAll() {
        return withLock(lock.readLock(), () -> store.values().stream()
                .map(Todo::copy)
                .sorted(NEWEST_FIRST)
                .toList());
    }

    @Override
    public Optional<Todo> findById(UUID id) {
        return withLock(lock.readLock(), () -> Optional.ofNullable(store.get(id)).map(Todo::copy));
    }

    @Override
    public Optional<Todo> update(UUID id, TodoUpdate update) {
        return withLock(lock.writeLock(), () -> {
            Todo current = store.get(id);
            if (current == null) return Optional.empty();
            // work on a copy so a rejected update never touches the stored entry
            Todo updated = current.copy().apply(update);
            store.put(id, updated);
            return Optional.of(updated.copy());
        });
    }

    @Override
    public boolean deleteById(UUID id) {
        return withLock(lock.writeLock(), () -> store.remove(id) != null);
    }

    private static <T> T withLock(Lock l, Supplier<T> action) {
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }
}
