package org.flutterjs.gen;

public class FlutterJsGenException extends RuntimeException {

    public FlutterJsGenException(String message) {
        super(message);
    }

    public FlutterJsGenException(String message, Throwable cause) {
        super(message, cause);
    }

    public FlutterJsGenException(Throwable cause) {
        super(cause);
    }
}
