package org.flutterjs.gen;

public class CodeGenerationException extends FlutterJsGenException {

    private final String nodeDescription;

    public CodeGenerationException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public CodeGenerationException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
