package org.flutterjs.ir.decl;

import java.util.List;

public record EnumDecl(String name, List<String> values) {

    public EnumDecl {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
