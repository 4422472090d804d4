package org.example.mjcf;

/** An internal invariant of the graph or tree was violated. */
public class ConsistencyException extends ExportException {

    public ConsistencyException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "consistency";
    }
}
