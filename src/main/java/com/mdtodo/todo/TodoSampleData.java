package com.mdtodo.todo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Seeds development data into an empty store when {@code todo.sample-data.enabled=true}. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "todo.sample-data", name = "enabled", havingValue = "true")
public class TodoSampleData implements ApplicationRunner {

    private final TodoRepository repository;

    @Override
    public void run(ApplicationArguments args) {
        if (!repository.findAll().isEmpty()) {
            log.info("sample data skipped: store is not empty");
            return;
        }
        List<Todo> samples = samples();
        samples.forEach(repository::save);
        log.info("seeded {} sample todos", samples.size());
    }

    static List<Todo> samples() {
        List<Todo> todos = new ArrayList<>();
        todos.add(Todo.create("Sample Task 1", """
                # Welcome to MD-Todo

                This is a **sample task** with *markdown* formatting.

                - [ ] Subtask 1
                - [x] Subtask 2
                - [ ] Subtask 3"""));

        Todo completed = Todo.create("Completed Task", """
                ## This task is completed

                This demonstrates how completed tasks appear in the UI.

                ```javascript
                console.log("Hello, World!");
                ```""");
        completed.setCompleted(true);
        todos.add(completed);

        todos.add(Todo.create("Task with Code", """
                ### Development Task

                Implement the following function:

                ```rust
                fn hello_world() {
                    println!("Hello, World!");
                }
                ```

                Make sure to include proper error handling."""));
        return todos;
    }
}
