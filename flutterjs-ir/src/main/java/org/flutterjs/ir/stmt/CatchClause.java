package org.flutterjs.ir.stmt;

import org.flutterjs.ir.type.TypeRef;

/**
 * {@code on ExceptionType catch (e, st) { ... }}. {@code exceptionType} is {@code null} for an
 * untyped catch; either parameter name may be {@code null}.
 */
public record CatchClause(TypeRef exceptionType,
                          String exceptionParameter,
                          String stackTraceParameter,
                          BlockStmt body) {

    public boolean isCatchAll() {
        return exceptionType == null;
    }
}
