package org.flutterjs.ir.decl;

import java.util.List;

public record ExportDirective(String uri, List<String> show, List<String> hide) {

    public ExportDirective {
        if (uri == null || uri.isEmpty()) {
            throw new IllegalArgumentException("Export URI must not be empty");
        }
        show = show == null ? List.of() : List.copyOf(show);
        hide = hide == null ? List.of() : List.copyOf(hide);
    }

    public static ExportDirective of(String uri) {
        return new ExportDirective(uri, List.of(), List.of());
    }
}
