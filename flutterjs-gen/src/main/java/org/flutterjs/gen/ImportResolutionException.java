package org.flutterjs.gen;

public class ImportResolutionException extends CodeGenerationException {

    private final String symbol;
    private final String moduleUri;

    public ImportResolutionException(String symbol, String moduleUri, String reason) {
        super("Cannot import '" + symbol + "' from '" + moduleUri + "': " + reason, moduleUri + "#" + symbol);
        this.symbol = symbol;
        this.moduleUri = moduleUri;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getModuleUri() {
        return moduleUri;
    }
}
