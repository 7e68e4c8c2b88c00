package org.flutterjs.ir;

import org.flutterjs.ir.decl.ClassDecl;
import org.flutterjs.ir.decl.EnumDecl;
import org.flutterjs.ir.decl.ExportDirective;
import org.flutterjs.ir.decl.FunctionDecl;
import org.flutterjs.ir.decl.ImportDirective;
import org.flutterjs.ir.decl.StateAnalysis;
import org.flutterjs.ir.decl.VariableDecl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One compilation unit of the source program. Read-only for the whole generation pass.
 *
 * @param filePath    path of the source file relative to its package root, e.g. {@code lib/src/home.dart}
 * @param packageName the logical package the unit belongs to, or {@code null} for a loose file
 */
public record ProgramUnit(String filePath,
                          String packageName,
                          List<ImportDirective> imports,
                          List<ExportDirective> exports,
                          List<ClassDecl> classes,
                          List<FunctionDecl> functions,
                          List<VariableDecl> variables,
                          List<EnumDecl> enums,
                          List<String> typedefNames,
                          Map<String, StateAnalysis> stateAnalyses) {

    public ProgramUnit {
        if (filePath == null || filePath.isEmpty()) {
            throw new IllegalArgumentException("Program unit needs a file path");
        }
        imports = imports == null ? List.of() : List.copyOf(imports);
        exports = exports == null ? List.of() : List.copyOf(exports);
        classes = classes == null ? List.of() : List.copyOf(classes);
        functions = functions == null ? List.of() : List.copyOf(functions);
        variables = variables == null ? List.of() : List.copyOf(variables);
        enums = enums == null ? List.of() : List.copyOf(enums);
        typedefNames = typedefNames == null ? List.of() : List.copyOf(typedefNames);
        stateAnalyses = stateAnalyses == null ? Map.of() : Map.copyOf(stateAnalyses);
    }

    /**
     * True when the unit declares nothing that could produce output.
     */
    public boolean isEmpty() {
        return classes.isEmpty() && functions.isEmpty() && variables.isEmpty()
                && enums.isEmpty() && exports.isEmpty();
    }

    /**
     * The {@code package:} URI other units use to import this one, e.g. {@code package:app/src/home.dart}.
     */
    public Optional<String> libraryUri() {
        if (packageName == null) {
            return Optional.empty();
        }
        String path = filePath.startsWith("lib/") ? filePath.substring(4) : filePath;
        return Optional.of("package:" + packageName + "/" + path);
    }

    public Optional<ClassDecl> findClass(String name) {
        return classes.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public Optional<StateAnalysis> stateAnalysis(String stateClassName) {
        return Optional.ofNullable(stateAnalyses.get(stateClassName));
    }

    public static Builder builder(String filePath) {
        return new Builder(filePath);
    }

    public static final class Builder {

        private final String filePath;
        private String packageName;
        private final List<ImportDirective> imports = new ArrayList<>();
        private final List<ExportDirective> exports = new ArrayList<>();
        private final List<ClassDecl> classes = new ArrayList<>();
        private final List<FunctionDecl> functions = new ArrayList<>();
        private final List<VariableDecl> variables = new ArrayList<>();
        private final List<EnumDecl> enums = new ArrayList<>();
        private final List<String> typedefNames = new ArrayList<>();
        private final Map<String, StateAnalysis> stateAnalyses = new LinkedHashMap<>();

        private Builder(String filePath) {
            this.filePath = filePath;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder addImport(ImportDirective directive) {
            imports.add(directive);
            return this;
        }

        public Builder addExport(ExportDirective directive) {
            exports.add(directive);
            return this;
        }

        public Builder addClass(ClassDecl classDecl) {
            classes.add(classDecl);
            return this;
        }

        public Builder addFunction(FunctionDecl function) {
            functions.add(function);
            return this;
        }

        public Builder addVariable(VariableDecl variable) {
            variables.add(variable);
            return this;
        }

        public Builder addEnum(EnumDecl enumDecl) {
            enums.add(enumDecl);
            return this;
        }

        public Builder addTypedef(String name) {
            typedefNames.add(name);
            return this;
        }

        public Builder addStateAnalysis(StateAnalysis analysis) {
            stateAnalyses.put(analysis.stateClassName(), analysis);
            return this;
        }

        public ProgramUnit build() {
            return new ProgramUnit(filePath, packageName, imports, exports, classes, functions,
                    variables, enums, typedefNames, stateAnalyses);
        }
    }
}
