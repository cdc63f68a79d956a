package de.mirkosertic.querywarmup.tokenizer;

/**
 * A token produced by an analyzer, with its position in the token stream.
 */
public record Token(int position, String text) {
}
