package org.flutterjs.gen.config;

public enum Target {
    /** Browser build against the FlutterJS widget runtime. */
    WEB,
    /** Plain Node.js module; framework imports are omitted. */
    NODE
}
