package de.mirkosertic.querywarmup.ast;

import de.mirkosertic.querywarmup.util.Bound;
import org.apache.lucene.queryparser.classic.ParseException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive descent parser turning user query text into a {@link QueryAst}.
 *
 * <h2>Syntax</h2>
 * <pre>
 * title:hello                 full text on a field
 * title:"hello world"~2       phrase, optional slop
 * title:hell*                 phrase prefix
 * title:h?ll*o                wildcard
 * count:[1 TO 10}  count:>=5  ranges, {@code *} leaves an end open
 * tag: IN [a b "c d"]         term set
 * title:*                     field presence
 * *                           match all
 * a AND b, a OR b, NOT a, -a, +a, (a b), a^2.0
 * hello                       full text on the default fields
 * </pre>
 * Juxtaposed clauses combine with the default operator. AND binds tighter than OR.
 */
final class UserQueryParser {

    static final String MISSING_DEFAULT_FIELDS = "query requires a default search field and none was supplied";
    static final String SET_WITHOUT_FIELD = "set query need to target a specific field";

    private List<String> defaultFields;
    private final BooleanOperand defaultOperator;
    private final boolean lenient;
    private final int maxExpansions;

    private String text;
    private int pos;

    UserQueryParser(final List<String> defaultFields, final BooleanOperand defaultOperator, final boolean lenient,
                    final int maxExpansions) {
        this.defaultFields = defaultFields == null ? List.of() : List.copyOf(defaultFields);
        this.defaultOperator = defaultOperator;
        this.lenient = lenient;
        this.maxExpansions = maxExpansions;
    }

    QueryAst parse(final String userText) throws ParseException {
        this.text = userText;
        this.pos = 0;
        skipWhitespace();
        if (atEnd()) {
            throw new ParseException("query is empty");
        }
        final QueryAst ast = parseOr();
        skipWhitespace();
        if (!atEnd()) {
            throw syntaxError("unexpected `" + peek() + "`");
        }
        return ast;
    }

    private QueryAst parseOr() throws ParseException {
        final List<QueryAst> clauses = new ArrayList<>();
        clauses.add(parseAnd());
        while (true) {
            skipWhitespace();
            if (atEnd() || peek() == ')') {
                break;
            }
            if (consumeKeyword("OR")) {
                clauses.add(parseAnd());
            } else if (defaultOperator == BooleanOperand.OR) {
                clauses.add(parseAnd());
            } else {
                throw syntaxError("unexpected `" + peek() + "`");
            }
        }
        return clauses.size() == 1 ? clauses.get(0) : BoolQuery.ofShould(clauses);
    }

    private QueryAst parseAnd() throws ParseException {
        final List<QueryAst> clauses = new ArrayList<>();
        clauses.add(parseUnary());
        while (true) {
            skipWhitespace();
            if (atEnd() || peek() == ')' || lookingAtKeyword("OR")) {
                break;
            }
            if (consumeKeyword("AND")) {
                clauses.add(parseUnary());
            } else if (defaultOperator == BooleanOperand.AND) {
                clauses.add(parseUnary());
            } else {
                break;
            }
        }
        if (clauses.size() == 1) {
            return clauses.get(0);
        }

        // Negated clauses are lifted into the must_not list of the conjunction
        final List<QueryAst> must = new ArrayList<>();
        final List<QueryAst> mustNot = new ArrayList<>();
        for (final QueryAst clause : clauses) {
            if (isNegation(clause)) {
                mustNot.addAll(((BoolQuery) clause).mustNot());
            } else {
                must.add(clause);
            }
        }
        return new BoolQuery(must, mustNot, List.of(), List.of(), null);
    }

    private QueryAst parseUnary() throws ParseException {
        skipWhitespace();
        if (atEnd()) {
            throw syntaxError("unexpected end of query");
        }
        if (consumeKeyword("NOT") || consumeChar('-')) {
            return BoolQuery.ofMustNot(List.of(parseUnary()));
        }
        if (consumeChar('+')) {
            return parseUnary();
        }
        return parseBoost(parsePrimary());
    }

    private QueryAst parsePrimary() throws ParseException {
        skipWhitespace();
        final char c = peek();
        if (c == '(') {
            pos++;
            final QueryAst inner = parseOr();
            skipWhitespace();
            expect(')');
            return inner;
        }
        if (c == '*' && isTerminator(pos + 1)) {
            pos++;
            return new MatchAllQuery();
        }
        if (c == '"') {
            final String phrase = readQuoted();
            final int slop = readSlop();
            return onDefaultFields(List.of(phrase), (field, value) -> phraseClause(field, value, slop));
        }
        if (lookingAtSetStart()) {
            throw new ParseException(SET_WITHOUT_FIELD);
        }
        final String word = readWord(true);
        if (!atEnd() && peek() == ':') {
            pos++;
            return parseFieldClause(word);
        }
        return onDefaultFields(List.of(word), this::valueClause);
    }

    private QueryAst parseFieldClause(final String field) throws ParseException {
        skipWhitespace();
        if (atEnd()) {
            throw syntaxError("expected a value for field `" + field + "`");
        }
        if (lookingAtSetStart()) {
            pos += 2;
            skipWhitespace();
            expect('[');
            return new TermSetQuery(Map.of(field, readSetValues()));
        }
        final char c = peek();
        if (c == '[' || c == '{') {
            return parseRange(field);
        }
        if (c == '>' || c == '<') {
            return parseComparison(field);
        }
        if (c == '"') {
            final String phrase = readQuoted();
            return phraseClause(field, phrase, readSlop());
        }
        if (c == '*' && isTerminator(pos + 1)) {
            pos++;
            return new FieldPresenceQuery(field);
        }
        if (c == '(') {
            pos++;
            final List<String> outerDefaultFields = defaultFields;
            defaultFields = List.of(field);
            try {
                final QueryAst inner = parseOr();
                skipWhitespace();
                expect(')');
                return inner;
            } finally {
                defaultFields = outerDefaultFields;
            }
        }
        return valueClause(field, readWord(false));
    }

    private QueryAst parseRange(final String field) throws ParseException {
        final boolean lowerInclusive = next() == '[';
        skipWhitespace();
        final String lower = readRangeValue();
        skipWhitespace();
        if (!consumeKeyword("TO")) {
            throw syntaxError("expected `TO` in range on field `" + field + "`");
        }
        skipWhitespace();
        final String upper = readRangeValue();
        skipWhitespace();
        if (atEnd()) {
            throw syntaxError("unterminated range on field `" + field + "`");
        }
        final char close = next();
        if (close != ']' && close != '}') {
            throw syntaxError("expected `]` or `}` to close the range on field `" + field + "`");
        }
        final boolean upperInclusive = close == ']';
        return new RangeQuery(field, rangeBound(lower, lowerInclusive), rangeBound(upper, upperInclusive), lenient);
    }

    private QueryAst parseComparison(final String field) throws ParseException {
        final char comparator = next();
        final boolean inclusive = consumeChar('=');
        skipWhitespace();
        final String value = peek() == '"' ? readQuoted() : unescape(readWord(false));
        final Bound<String> bound = inclusive ? Bound.included(value) : Bound.excluded(value);
        if (comparator == '>') {
            return new RangeQuery(field, bound, Bound.unbounded(), lenient);
        }
        return new RangeQuery(field, Bound.unbounded(), bound, lenient);
    }

    private QueryAst parseBoost(final QueryAst query) throws ParseException {
        if (atEnd() || peek() != '^') {
            return query;
        }
        pos++;
        final int start = pos;
        while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
            pos++;
        }
        final float boost;
        try {
            boost = Float.parseFloat(text.substring(start, pos));
        } catch (final NumberFormatException e) {
            throw syntaxError("invalid boost `" + text.substring(start, pos) + "`");
        }
        if (!Float.isFinite(boost)) {
            throw syntaxError("invalid boost `" + text.substring(start, pos) + "`");
        }
        return new BoostQuery(query, boost);
    }

    private QueryAst valueClause(final String field, final String raw) {
        if (hasUnescapedWildcard(raw)) {
            if (isPrefixPattern(raw)) {
                final String prefix = unescape(raw.substring(0, raw.length() - 1));
                return new PhrasePrefixQuery(field, prefix, maxExpansions,
                        FullTextParams.of(new FullTextMode.Phrase(0)), lenient);
            }
            return new WildcardQuery(field, raw, lenient);
        }
        return new FullTextQuery(field, unescape(raw),
                FullTextParams.of(new FullTextMode.PhraseFallbackToIntersection()), lenient);
    }

    private QueryAst phraseClause(final String field, final String phrase, final int slop) {
        return new FullTextQuery(field, phrase, FullTextParams.of(new FullTextMode.Phrase(slop)), lenient);
    }

    private QueryAst onDefaultFields(final List<String> values, final ClauseFactory factory) throws ParseException {
        if (defaultFields.isEmpty()) {
            throw new ParseException(MISSING_DEFAULT_FIELDS);
        }
        final List<QueryAst> clauses = new ArrayList<>();
        for (final String field : defaultFields) {
            for (final String value : values) {
                clauses.add(factory.create(field, value));
            }
        }
        return clauses.size() == 1 ? clauses.get(0) : BoolQuery.ofShould(clauses);
    }

    private Set<String> readSetValues() throws ParseException {
        final Set<String> values = new LinkedHashSet<>();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw syntaxError("unterminated set");
            }
            if (peek() == ']') {
                pos++;
                return values;
            }
            if (peek() == '"') {
                values.add(readQuoted());
            } else {
                final int start = pos;
                while (!atEnd() && !Character.isWhitespace(peek()) && peek() != ']') {
                    if (peek() == '\\' && pos + 1 < text.length()) {
                        pos++;
                    }
                    pos++;
                }
                values.add(unescape(text.substring(start, pos)));
            }
        }
    }

    private String readRangeValue() throws ParseException {
        if (atEnd()) {
            throw syntaxError("expected a range bound");
        }
        if (peek() == '"') {
            return readQuoted();
        }
        final int start = pos;
        while (!atEnd() && !Character.isWhitespace(peek()) && peek() != ']' && peek() != '}') {
            if (peek() == '\\' && pos + 1 < text.length()) {
                pos++;
            }
            pos++;
        }
        if (start == pos) {
            throw syntaxError("expected a range bound");
        }
        return text.substring(start, pos);
    }

    private Bound<String> rangeBound(final String raw, final boolean inclusive) {
        if ("*".equals(raw)) {
            return Bound.unbounded();
        }
        final String value = unescape(raw);
        return inclusive ? Bound.included(value) : Bound.excluded(value);
    }

    /**
     * Reads a field name or a value. Escape sequences are kept as they are.
     */
    private String readWord(final boolean stopAtColon) throws ParseException {
        final int start = pos;
        while (!atEnd()) {
            final char c = peek();
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '^' || c == '"'
                    || (stopAtColon && c == ':')) {
                break;
            }
            if (c == '\\' && pos + 1 < text.length()) {
                pos++;
            }
            pos++;
        }
        if (start == pos) {
            throw syntaxError("expected a value");
        }
        return text.substring(start, pos);
    }

    private String readQuoted() throws ParseException {
        expect('"');
        final StringBuilder result = new StringBuilder();
        while (!atEnd()) {
            final char c = next();
            if (c == '\\' && !atEnd()) {
                result.append(next());
            } else if (c == '"') {
                return result.toString();
            } else {
                result.append(c);
            }
        }
        throw syntaxError("unterminated phrase");
    }

    private int readSlop() throws ParseException {
        if (atEnd() || peek() != '~') {
            return 0;
        }
        pos++;
        final int start = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        if (start == pos) {
            throw syntaxError("expected a slop after `~`");
        }
        return Integer.parseInt(text.substring(start, pos));
    }

    private boolean lookingAtSetStart() {
        if (!text.startsWith("IN", pos)) {
            return false;
        }
        int i = pos + 2;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i < text.length() && text.charAt(i) == '[';
    }

    private boolean lookingAtKeyword(final String keyword) {
        if (!text.startsWith(keyword, pos)) {
            return false;
        }
        final int end = pos + keyword.length();
        return end >= text.length() || Character.isWhitespace(text.charAt(end)) || text.charAt(end) == '(';
    }

    private boolean consumeKeyword(final String keyword) {
        if (lookingAtKeyword(keyword)) {
            pos += keyword.length();
            return true;
        }
        return false;
    }

    private boolean consumeChar(final char c) {
        if (!atEnd() && peek() == c) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(final char c) throws ParseException {
        if (atEnd() || peek() != c) {
            throw syntaxError("expected `" + c + "`");
        }
        pos++;
    }

    private boolean isTerminator(final int index) {
        return index >= text.length() || Character.isWhitespace(text.charAt(index)) || text.charAt(index) == ')';
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private char next() {
        return text.charAt(pos++);
    }

    private ParseException syntaxError(final String message) {
        return new ParseException(message + " at position " + pos + " in `" + text + "`");
    }

    private static boolean isNegation(final QueryAst clause) {
        return clause instanceof BoolQuery bool
                && bool.must().isEmpty() && bool.should().isEmpty() && bool.filter().isEmpty()
                && !bool.mustNot().isEmpty();
    }

    static boolean hasUnescapedWildcard(final String raw) {
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '*' || c == '?') {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the only wildcard of the pattern is a single trailing {@code *} after a non empty prefix.
     */
    static boolean isPrefixPattern(final String raw) {
        if (raw.length() < 2 || raw.charAt(raw.length() - 1) != '*') {
            return false;
        }
        final String prefix = raw.substring(0, raw.length() - 1);
        if (prefix.endsWith("\\") && !prefix.endsWith("\\\\")) {
            return false;
        }
        return !hasUnescapedWildcard(prefix);
    }

    static String unescape(final String raw) {
        if (raw.indexOf('\\') < 0) {
            return raw;
        }
        final StringBuilder result = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c == '\\' && i + 1 < raw.length()) {
                result.append(raw.charAt(++i));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    @FunctionalInterface
    private interface ClauseFactory {
        QueryAst create(String field, String value);
    }
}
