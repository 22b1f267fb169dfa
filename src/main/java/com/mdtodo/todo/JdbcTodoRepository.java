package com.mdtodo.todo;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TodoRepository} on the {@code todos} table (see {@code schema.sql}).
 *
 * <p>Only plain {@code ?} placeholders and ANSI statements are used, so the same code runs on
 * PostgreSQL and H2. The upsert is an {@code UPDATE} that falls back to an {@code INSERT} inside one
 * transaction; a partial update locks its row with {@code SELECT ... FOR UPDATE} before writing.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "todo.storage", name = "type", havingValue = "jdbc")
public class JdbcTodoRepository implements TodoRepository {

    private static final String COLUMNS = "id, title, content, completed, created_at, updated_at";

    private static final String SELECT_ALL =
            "SELECT " + COLUMNS + " FROM todos ORDER BY created_at DESC";
    private static final String SELECT_BY_ID =
            "SELECT " + COLUMNS + " FROM todos WHERE id = ?";
    private static final String SELECT_BY_ID_FOR_UPDATE = SELECT_BY_ID + " FOR UPDATE";
    private static final String INSERT =
            "INSERT INTO todos (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)";
    private static final String UPDATE =
            "UPDATE todos SET title = ?, content = ?, completed = ?, created_at = ?, updated_at = ? WHERE id = ?";
    private static final String DELETE = "DELETE FROM todos WHERE id = ?";

    private static final RowMapper<Todo> ROW_MAPPER = (rs, rowNum) -> new Todo(
            rs.getObject("id", UUID.class),
            rs.getString("title"),
            rs.getString("content"),
            rs.getBoolean("completed"),
            toInstant(rs.getObject("created_at", OffsetDateTime.class)),
            toInstant(rs.getObject("updated_at", OffsetDateTime.class)));

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcTodoRepository(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @Override
    public Todo save(Todo todo) {
        todo.validate();
        tx.executeWithoutResult(status -> {
            if (writeRow(todo) == 0) {
                jdbc.update(INSERT,
                        todo.getId(), todo.getTitle(), todo.getContent(), todo.isCompleted(),
                        toOffset(todo.getCreatedAt()), toOffset(todo.getUpdatedAt()));
                log.debug("inserted todo {}", todo.getId());
            } else {
                log.debug("replaced todo {}", todo.getId());
            }
        });
        return todo.copy();
    }

    @Override
    public List<Todo> findAll() {
        return jdbc.query(SELECT_ALL, ROW_MAPPER);
    }

    @Override
    public Optional<Todo> findById(UUID id) {
        return jdbc.query(SELECT_BY_ID, ROW_MAPPER, id).stream().findFirst();
    }

    @Override
    public Optional<Todo> update(UUID id, TodoUpdate update) {
        return tx.execute(status -> {
            Optional<Todo> current = jdbc.query(SELECT_BY_ID_FOR_UPDATE, ROW_MAPPER, id).stream().findFirst();
            if (current.isEmpty()) return Optional.<Todo>empty();

            // a validation failure here rolls the transaction back before anything is written
            Todo updated = current.get().apply(update);
            writeRow(updated);
            return Optional.of(updated);
        });
    }

    @Override
    public boolean deleteById(UUID id) {
        return jdbc.update(DELETE, id) > 0;
    }

    private int writeRow(Todo todo) {
        return jdbc.update(UPDATE,
                todo.getTitle(), todo.getContent(), todo.isCompleted(),
                toOffset(todo.getCreatedAt()), toOffset(todo.getUpdatedAt()), todo.getId());
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
