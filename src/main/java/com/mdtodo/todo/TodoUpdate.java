package com.mdtodo.todo;

/** Partial update. A {@code null} field is left unchanged. */
public record TodoUpdate(
        String title,
        String content,
        Boolean completed
) {
    public void validate() {
        if (title != null) Todo.validateTitle(title);
        if (content != null) Todo.validateContent(content);
    }
}
