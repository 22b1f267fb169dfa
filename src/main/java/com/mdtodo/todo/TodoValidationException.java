package com.mdtodo.todo;

/** A title or content value broke one of the Todo field rules. */
public class TodoValidationException extends IllegalArgumentException {

    public TodoValidationException(String message) {
        super(message);
    }
}
