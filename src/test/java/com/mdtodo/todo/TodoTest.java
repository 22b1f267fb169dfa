package com.mdtodo.todo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Todo domain model")
class TodoTest {

    @Nested
    @DisplayName("title rules")
    class TitleValidation {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("blank title is rejected")
        void blankTitle(String title) {
            assertThatThrownBy(() -> Todo.validateTitle(title))
                    .isInstanceOf(TodoValidationException.class)
                    .hasMessage("Title cannot be empty");
        }

        @Test
        @DisplayName("null title is rejected as empty")
        void nullTitle() {
            assertThatThrownBy(() -> Todo.validateTitle(null))
                    .hasMessage("Title cannot be empty");
        }

        @Test
        @DisplayName("255 characters is the upper bound")
        void titleLengthBoundary() {
            assertThatCode(() -> Todo.validateTitle("a".repeat(255))).doesNotThrowAnyException();
            assertThatThrownBy(() -> Todo.validateTitle("a".repeat(256)))
                    .hasMessage("Title cannot exceed 255 characters");
        }

        @Test
        @DisplayName("length counts characters, not UTF-16 units")
        void titleCountsCodePoints() {
            // each emoji is two chars in UTF-16
            String emojis = "🚀".repeat(255);
            assertThat(emojis.length()).isEqualTo(510);
            assertThatCode(() -> Todo.validateTitle(emojis)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"Title\nwith\nnewlines", "carriage\rreturn", "trailing\n"})
        @DisplayName("newlines are rejected")
        void titleWithNewlines(String title) {
            assertThatThrownBy(() -> Todo.validateTitle(title))
                    .hasMessage("Title cannot contain newlines");
        }

        @Test
        @DisplayName("length is checked before newlines")
        void lengthWinsOverNewline() {
            assertThatThrownBy(() -> Todo.validateTitle("a\n".repeat(200)))
                    .hasMessage("Title cannot exceed 255 characters");
        }
    }

    @Nested
    @DisplayName("content rules")
    class ContentValidation {

        @Test
        @DisplayName("empty content is allowed")
        void emptyContent() {
            assertThatCode(() -> Todo.validateContent("")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("10000 characters is the upper bound")
        void contentLengthBoundary() {
            assertThatCode(() -> Todo.validateContent("a".repeat(10_000))).doesNotThrowAnyException();
            assertThatThrownBy(() -> Todo.validateContent("a".repeat(10_001)))
                    .hasMessage("Content cannot exceed 10000 characters");
        }

        @Test
        @DisplayName("null content is rejected")
        void nullContent() {
            assertThatThrownBy(() -> Todo.validateContent(null))
                    .hasMessage("Content is required");
        }

        @Test
        @DisplayName("markdown, accents and emoji are accepted as-is")
        void specialCharacters() {
            Todo todo = Todo.create("Test", "# Header\n\n**Bold** àáâãäå [link](https://example.com) 🚀 🎉");

            assertThat(todo.getContent())
                    .contains("# Header", "**Bold**", "[link](https://example.com)", "🚀");
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("new todo is open with equal timestamps and a v7 id")
        void newTodo() {
            Instant before = Instant.now();

            Todo todo = Todo.create("Test Title", "Test Content");

            assertThat(todo.getTitle()).isEqualTo("Test Title");
            assertThat(todo.getContent()).isEqualTo("Test Content");
            assertThat(todo.isCompleted()).isFalse();
            assertThat(todo.getId().version()).isEqualTo(7);
            assertThat(todo.getCreatedAt()).isEqualTo(todo.getUpdatedAt());
            assertThat(todo.getCreatedAt()).isAfterOrEqualTo(before.truncatedTo(ChronoUnit.MICROS));
        }

        @Test
        @DisplayName("invalid title fails creation")
        void invalidTitle() {
            assertThatThrownBy(() -> Todo.create("", "content"))
                    .hasMessage("Title cannot be empty");
            assertThatThrownBy(() -> Todo.create("a".repeat(256), "content"))
                    .hasMessage("Title cannot exceed 255 characters");
        }

        @Test
        @DisplayName("ids are unique and ordered by creation")
        void idsAreOrdered() {
            Todo first = Todo.create("Title 1", "Content 1");
            Todo second = Todo.create("Title 2", "Content 2");

            assertThat(first.getId()).isNotEqualTo(second.getId());
            assertThat(first.getId()).isLessThan(second.getId());
            assertThat(first.getCreatedAt()).isBeforeOrEqualTo(second.getCreatedAt());
        }
    }

    @Nested
    @DisplayName("mutation helpers")
    class Mutation {

        @Test
        @DisplayName("updateTitle keeps createdAt and moves updatedAt forward")
        void updateTitle() {
            Todo todo = Todo.create("Original Title", "Original Content");
            Instant createdAt = todo.getCreatedAt();

            todo.updateTitle("Updated Title");

            assertThat(todo.getTitle()).isEqualTo("Updated Title");
            assertThat(todo.getCreatedAt()).isEqualTo(createdAt);
            assertThat(todo.getUpdatedAt()).isAfter(createdAt);
        }

        @Test
        @DisplayName("updateContent keeps createdAt and moves updatedAt forward")
        void updateContent() {
            Todo todo = Todo.create("Original Title", "Original Content");
            Instant createdAt = todo.getCreatedAt();

            todo.updateContent("Updated Content");

            assertThat(todo.getContent()).isEqualTo("Updated Content");
            assertThat(todo.getCreatedAt()).isEqualTo(createdAt);
            assertThat(todo.getUpdatedAt()).isAfter(createdAt);
        }

        @Test
        @DisplayName("invalid updateTitle leaves the todo untouched")
        void invalidUpdateTitle() {
            Todo todo = Todo.create("Original Title", "Original Content");
            Instant updatedAt = todo.getUpdatedAt();

            assertThatThrownBy(() -> todo.updateTitle("bad\ntitle"))
                    .isInstanceOf(TodoValidationException.class);

            assertThat(todo.getTitle()).isEqualTo("Original Title");
            assertThat(todo.getUpdatedAt()).isEqualTo(updatedAt);
        }

        @Test
        @DisplayName("toggleCompleted flips the flag each time")
        void toggleCompleted() {
            Todo todo = Todo.create("Test Title", "Test Content");
            Instant createdAt = todo.getCreatedAt();

            todo.toggleCompleted();
            assertThat(todo.isCompleted()).isTrue();
            assertThat(todo.getUpdatedAt()).isAfter(createdAt);

            todo.toggleCompleted();
            assertThat(todo.isCompleted()).isFalse();
        }
    }

    @Nested
    @DisplayName("apply(TodoUpdate)")
    class Apply {

        @Test
        @DisplayName("applies every supplied field")
        void appliesAllFields() {
            Todo todo = Todo.create("Original Title", "Original Content");

            todo.apply(new TodoUpdate("Updated Title", "Updated Content", true));

            assertThat(todo.getTitle()).isEqualTo("Updated Title");
            assertThat(todo.getContent()).isEqualTo("Updated Content");
            assertThat(todo.isCompleted()).isTrue();
        }

        @Test
        @DisplayName("null fields keep their current value")
        void keepsOmittedFields() {
            Todo todo = Todo.create("Original Title", "Original Content");

            todo.apply(new TodoUpdate(null, null, true));

            assertThat(todo.getTitle()).isEqualTo("Original Title");
            assertThat(todo.getContent()).isEqualTo("Original Content");
            assertThat(todo.isCompleted()).isTrue();
        }

        @Test
        @DisplayName("one invalid field rejects the whole update")
        void allOrNothing() {
            Todo todo = Todo.create("Original Title", "Original Content");
            Todo before = todo.copy();

            assertThatThrownBy(() -> todo.apply(new TodoUpdate("Fine title", "a".repeat(10_001), true)))
                    .hasMessage("Content cannot exceed 10000 characters");

            assertThat(todo).isEqualTo(before);
        }

        @Test
        @DisplayName("empty title in an update is rejected")
        void emptyTitle() {
            Todo todo = Todo.create("Original Title", "Original Content");

            assertThatThrownBy(() -> todo.apply(new TodoUpdate("", null, null)))
                    .hasMessage("Title cannot be empty");
            assertThat(todo.getTitle()).isEqualTo("Original Title");
        }
    }

    @Test
    @DisplayName("copy is equal but independent")
    void copyIsIndependent() {
        Todo original = Todo.create("Original Title", "Original Content");

        Todo copy = original.copy();
        copy.updateTitle("Changed");

        assertThat(original.getTitle()).isEqualTo("Original Title");
        assertThat(copy.getId()).isEqualTo(original.getId());
        assertThat(copy.getCreatedAt()).isEqualTo(original.getCreatedAt());
    }

    @Test
    @DisplayName("validate() re-checks a restored todo")
    void validateRestored() {
        Instant now = Instant.now();
        Todo restored = new Todo(UUID.randomUUID(), " ", "content", false, now, now);

        assertThatThrownBy(restored::validate).hasMessage("Title cannot be empty");
        assertThatCode(() -> Todo.create("ok", "").validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("updatedAt before createdAt is rejected")
    void timestampOrder() {
        Instant now = Instant.now();

        assertThatThrownBy(() -> new Todo(UUID.randomUUID(), "Title", "", false, now, now.minusSeconds(60)))
                .isInstanceOf(TodoValidationException.class)
                .hasMessage("updatedAt cannot precede createdAt");
    }

    @Test
    @DisplayName("request payloads use the same rules")
    void requestValidation() {
        assertThatCode(() -> new CreateTodoRequest("Valid Title", "Valid content").validate())
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> new CreateTodoRequest("", "Valid content").validate())
                .hasMessage("Title cannot be empty");
        assertThatThrownBy(() -> new CreateTodoRequest("Valid title", "a".repeat(10_001)).validate())
                .hasMessage("Content cannot exceed 10000 characters");

        assertThatCode(() -> new TodoUpdate(null, null, null).validate()).doesNotThrowAnyException();
        assertThatThrownBy(() -> new TodoUpdate("a".repeat(256), null, null).validate())
                .hasMessage("Title cannot exceed 255 characters");
    }
}
