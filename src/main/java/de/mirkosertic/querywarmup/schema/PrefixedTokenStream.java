package de.mirkosertic.querywarmup.schema;

import de.mirkosertic.querywarmup.tokenizer.Token;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.PositionIncrementAttribute;

import java.io.IOException;
import java.util.List;

/**
 * Replays already analyzed tokens, each prefixed with a fixed string. Used to index the string
 * values of JSON fields under their path.
 */
final class PrefixedTokenStream extends TokenStream {

    private final CharTermAttribute termAttribute = addAttribute(CharTermAttribute.class);
    private final PositionIncrementAttribute positionAttribute = addAttribute(PositionIncrementAttribute.class);

    private final String prefix;
    private final List<Token> tokens;
    private int next;
    private int lastPosition;

    PrefixedTokenStream(final String prefix, final List<Token> tokens) {
        this.prefix = prefix;
        this.tokens = List.copyOf(tokens);
        this.lastPosition = -1;
    }

    @Override
    public boolean incrementToken() {
        if (next >= tokens.size()) {
            return false;
        }
        clearAttributes();
        final Token token = tokens.get(next++);
        termAttribute.setEmpty().append(prefix).append(token.text());
        positionAttribute.setPositionIncrement(token.position() - lastPosition);
        lastPosition = token.position();
        return true;
    }

    @Override
    public void reset() throws IOException {
        super.reset();
        next = 0;
        lastPosition = -1;
    }
}
