package com.mdtodo.todo;

import com.mdtodo.web.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/todos")
@RequiredArgsConstructor
@Tag(name = "todos", description = "Markdown todo items")
public class TodoController {

    private final TodoService service;

    @Operation(summary = "List todos, newest first")
    @GetMapping
    public ApiResponse<List<Todo>> list() {
        return ApiResponse.success(service.list());
    }

    @Operation(summary = "Create a todo")
    @PostMapping
    public ApiResponse<Todo> create(@RequestBody CreateTodoRequest request) {
        return ApiResponse.success(service.create(request));
    }

    @Operation(summary = "Get a todo by id")
    @GetMapping("/{id}")
    public ApiResponse<Todo> get(@PathVariable UUID id) {
        return ApiResponse.success(service.get(id));
    }

    @Operation(summary = "Partially update a todo; omitted fields are kept")
    @RequestMapping(value = "/{id}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    public ApiResponse<Todo> update(@PathVariable UUID id, @RequestBody TodoUpdate update) {
        return ApiResponse.success(service.update(id, update));
    }

    @Operation(summary = "Delete a todo")
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        service.delete(id);
    }
}
