package org.zepto8.fixer;

/**
 * Location of a compound assignment statement ({@code a += b}), from the start of its
 * target to the end of its value list.
 *
 * @param line   1-based line of the statement start
 * @param column 0-based offset of the statement start within the line
 * @param length length of the whole statement
 */
public record Reassignment(int line, int column, int length) {}
