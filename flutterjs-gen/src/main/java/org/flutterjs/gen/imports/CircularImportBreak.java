package org.flutterjs.gen.imports;

/**
 * A known import cycle: {@code importingLibrary} needs {@code symbol} from {@code providingLibrary},
 * while the providing library also constructs types declared alongside the importing one.
 */
public record CircularImportBreak(String importingLibrary,
                                  String providingLibrary,
                                  String symbol,
                                  BreakStrategy strategy) {
}
