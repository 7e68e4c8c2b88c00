package org.flutterjs.gen;

public class GenerationOptionsException extends FlutterJsGenException {

    private final String option;

    public GenerationOptionsException(String option, String message) {
        super("Invalid generation option '" + option + "': " + message);
        this.option = option;
    }

    public String getOption() {
        return option;
    }
}
