package com.mdtodo.todo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TodoService {

    private final TodoRepository repository;

    public List<Todo> list() {
        return repository.findAll();
    }

    public Todo get(UUID id) {
        return repository.findById(id).orElseThrow(() -> new TodoNotFoundException(id));
    }

    public Todo create(CreateTodoRequest request) {
        if (request == null) throw new TodoValidationException("Request body required");
        request.validate();

        Todo saved = repository.save(Todo.create(request.title(), request.content()));
        log.info("todo created: id={}", saved.getId());
        return saved;
    }

    public Todo update(UUID id, TodoUpdate update) {
        if (update == null) throw new TodoValidationException("Request body required");
        // reject bad input before the repository takes its lock
        update.validate();

        Todo updated = repository.update(id, update).orElseThrow(() -> new TodoNotFoundException(id));
        log.info("todo updated: id={}, completed={}", id, updated.isCompleted());
        return updated;
    }

    public void delete(UUID id) {
        if (!repository.deleteById(id)) throw new TodoNotFoundException(id);
        log.info("todo deleted: id={}", id);
    }
}
