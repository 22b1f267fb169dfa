package com.mdtodo.todo;

public record CreateTodoRequest(
        String title,
        String content   // markdown
) {
    public void validate() {
        Todo.validateTitle(title);
        Todo.validateContent(content);
    }
}
