package org.flutterjs.gen;

/**
 * A getter and setter share a name but cannot be merged into one accessor function.
 */
public class IncompatibleAccessorException extends CodeGenerationException {

    private final String ownerName;
    private final String accessorName;

    public IncompatibleAccessorException(String ownerName, String accessorName, String reason) {
        super("Cannot merge getter/setter '" + accessorName + "' on '" + ownerName + "': " + reason,
              ownerName + "." + accessorName);
        this.ownerName = ownerName;
        this.accessorName = accessorName;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public String getAccessorName() {
        return accessorName;
    }
}
