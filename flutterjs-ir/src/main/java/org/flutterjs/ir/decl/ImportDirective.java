package org.flutterjs.ir.decl;

import java.util.List;

/**
 * {@code import 'uri' as prefix show a, b hide c;}
 */
public record ImportDirective(String uri, String prefix, List<String> show, List<String> hide) {

    public ImportDirective {
        if (uri == null || uri.isEmpty()) {
            throw new IllegalArgumentException("Import URI must not be empty");
        }
        show = show == null ? List.of() : List.copyOf(show);
        hide = hide == null ? List.of() : List.copyOf(hide);
    }

    public static ImportDirective of(String uri) {
        return new ImportDirective(uri, null, List.of(), List.of());
    }
}
