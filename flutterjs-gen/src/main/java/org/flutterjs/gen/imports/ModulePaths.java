package org.flutterjs.gen.imports;

import org.flutterjs.ir.ProgramUnit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites source import URIs into target module specifiers:
 * <ul>
 *   <li>{@code dart:async} becomes {@code @flutterjs/dart/async}</li>
 *   <li>{@code package:flutter/...} becomes the runtime material module</li>
 *   <li>{@code package:<own package>/x.dart} becomes a relative path to {@code x.js}</li>
 *   <li>{@code package:foo/foo.dart} becomes {@code @flutterjs/foo}; other files of {@code foo}
 *       become {@code @flutterjs/foo/dist/<path>.js}</li>
 *   <li>relative URIs keep their path with a {@code .js} extension and an explicit {@code ./}</li>
 * </ul>
 */
public final class ModulePaths {

    private static final String PACKAGE = "package:";
    private static final String DART = "dart:";
    private static final String EXTERNAL_SCOPE = "@flutterjs/";

    private ModulePaths() {
    }

    public static String toModulePath(String uri, ProgramUnit from) {
        if (uri.startsWith(DART)) {
            return RuntimeModules.CORE_PREFIX + uri.substring(DART.length());
        }
        if (uri.startsWith(PACKAGE)) {
            String rest = uri.substring(PACKAGE.length());
            int slash = rest.indexOf('/');
            String packageName = slash < 0 ? rest : rest.substring(0, slash);
            String path = slash < 0 ? "" : rest.substring(slash + 1);
            if (packageName.isEmpty()) {
                throw new IllegalArgumentException("no package name in '" + uri + "'");
            }
            if (packageName.equals("flutter") || packageName.equals("flutterjs")) {
                return RuntimeModules.MATERIAL;
            }
            if (packageName.equals(from.packageName())) {
                return relativePath(sourceDirectory(from), withJsExtension(path));
            }
            if (path.isEmpty() || path.equals(packageName + ".dart")) {
                return EXTERNAL_SCOPE + packageName;
            }
            return EXTERNAL_SCOPE + packageName + "/dist/" + withJsExtension(path);
        }
        String path = withJsExtension(uri);
        if (path.startsWith(".") || path.startsWith("/") || path.startsWith("@")) {
            return path;
        }
        return "./" + path;
    }

    /**
     * True for URIs served by the runtime rather than by another generated file.
     */
    public static boolean isRuntimeUri(String uri) {
        return uri.startsWith(DART) || uri.startsWith("package:flutter/") || uri.startsWith("package:flutterjs/");
    }

    /**
     * The file name of a URI without directory or extension, e.g. {@code base_client} for
     * {@code package:http/src/base_client.dart}.
     */
    public static String baseName(String uri) {
        String path = uri;
        if (path.startsWith(PACKAGE)) {
            path = path.substring(PACKAGE.length());
        } else if (path.startsWith(DART)) {
            path = path.substring(DART.length());
        }
        int slash = path.lastIndexOf('/');
        if (slash >= 0) {
            path = path.substring(slash + 1);
        }
        return path.endsWith(".dart") ? path.substring(0, path.length() - 5) : path;
    }

    /**
     * Number of path segments after the scheme, used to prefer shorter library paths.
     */
    public static int segmentCount(String uri) {
        String path = uri.startsWith(PACKAGE) ? uri.substring(PACKAGE.length()) : uri;
        return path.split("/").length;
    }

    static String withJsExtension(String path) {
        if (path.endsWith(".dart")) {
            return path.substring(0, path.length() - 5) + ".js";
        }
        return path.endsWith(".js") ? path : path + ".js";
    }

    private static List<String> sourceDirectory(ProgramUnit unit) {
        String path = unit.filePath().replace('\\', '/');
        if (path.startsWith("lib/")) {
            path = path.substring(4);
        }
        List<String> segments = new ArrayList<>(Arrays.asList(path.split("/")));
        segments.remove(segments.size() - 1);
        return segments;
    }

    static String relativePath(List<String> fromDirectory, String targetPath) {
        List<String> target = new ArrayList<>(Arrays.asList(targetPath.split("/")));
        int common = 0;
        while (common < fromDirectory.size() && common < target.size() - 1
                && fromDirectory.get(common).equals(target.get(common))) {
            common++;
        }
        StringBuilder sb = new StringBuilder();
        int ups = fromDirectory.size() - common;
        if (ups == 0) {
            sb.append("./");
        } else {
            sb.append("../".repeat(ups));
        }
        sb.append(String.join("/", target.subList(common, target.size())));
        return sb.toString();
    }
}
