package com.mdtodo.todo;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * A single todo item whose {@code content} is markdown.
 *
 * <p>Instances are mutable and not thread-safe; repositories hand out copies.
 * Timestamps are kept at microsecond precision so they survive a round trip
 * through a {@code TIMESTAMP WITH TIME ZONE} column unchanged.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "title", "content", "completed", "created_at", "updated_at"})
public class Todo {

    public static final int MAX_TITLE_LENGTH = 255;
    public static final int MAX_CONTENT_LENGTH = 10_000;

    private final UUID id;
    private String title;
    private String content;   // markdown
    private boolean completed;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant updatedAt;

    public Todo(UUID id, String title, String content, boolean completed,
                Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.content = content;
        this.completed = completed;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        if (updatedAt.isBefore(createdAt))
            throw new TodoValidationException("updatedAt cannot precede createdAt");
    }

    /** New, not yet completed todo with a fresh v7 id. Both timestamps are equal. */
    public static Todo create(String title, String content) {
        validateTitle(title);
        validateContent(content);
        Instant now = now();
        return new Todo(UuidV7.generate(), title, content, false, now, now);
    }

    // ====== Validation ======

    public static void validateTitle(String title) {
        if (title == null || title.isBlank())
            throw new TodoValidationException("Title cannot be empty");
        if (title.codePointCount(0, title.length()) > MAX_TITLE_LENGTH)
            throw new TodoValidationException("Title cannot exceed " + MAX_TITLE_LENGTH + " characters");
        if (title.indexOf('\n') >= 0 || title.indexOf('\r') >= 0)
            throw new TodoValidationException("Title cannot contain newlines");
    }

    public static void validateContent(String content) {
        if (content == null)
            throw new TodoValidationException("Content is required");
        if (content.codePointCount(0, content.length()) > MAX_CONTENT_LENGTH)
            throw new TodoValidationException("Content cannot exceed " + MAX_CONTENT_LENGTH + " characters");
    }

    /** Field rules for a todo about to be stored; timestamp order is enforced by the constructor. */
    public void validate() {
        validateTitle(title);
        validateContent(content);
    }

    // ====== Mutation ======

    public void updateTitle(String title) {
        validateTitle(title);
        this.title = title;
        touch();
    }

    public void updateContent(String content) {
        validateContent(content);
        this.content = content;
        touch();
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
        touch();
    }

    public void toggleCompleted() {
        setCompleted(!completed);
    }

    /**
     * Applies every non-null field of {@code update}. All fields are validated
     * before any of them is written, so a rejected update leaves this todo as it was.
     */
    public Todo apply(TodoUpdate update) {
        update.validate();
        if (update.title() != null) this.title = update.title();
        if (update.content() != null) this.content = update.content();
        if (update.completed() != null) this.completed = update.completed();
        touch();
        return this;
    }

    public Todo copy() {
        return new Todo(id, title, content, completed, createdAt, updatedAt);
    }

    // updatedAt never moves backwards, even when two mutations share a clock tick
    private void touch() {
        Instant now = now();
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plus(1, ChronoUnit.MICROS);
    }

    static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
