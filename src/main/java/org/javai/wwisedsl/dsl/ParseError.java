package org.javai.wwisedsl.dsl;

import org.javai.wwisedsl.FailureKind;

/**
 * A line the parser skipped.
 *
 * @param lineNumber 1-based line number in the parsed text
 * @param kind the parse-phase failure kind
 * @param line the offending line after sanitizing
 * @param message what was wrong with it
 */
public record ParseError(int lineNumber, FailureKind kind, String line, String message) {
}
