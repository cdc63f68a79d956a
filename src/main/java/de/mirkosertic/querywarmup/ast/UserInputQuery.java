package de.mirkosertic.querywarmup.ast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.lucene.queryparser.classic.ParseException;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Query text as typed by a user. It has to be parsed with {@link #parse(List, int)} into a
 * structured query before it can be compiled.
 *
 * @param userText        the raw query text
 * @param defaultFields   fields targeted by clauses without an explicit field, if set
 * @param defaultOperator how juxtaposed clauses combine
 * @param lenient         whether clauses on missing fields match nothing instead of failing
 */
public record UserInputQuery(
        @JsonProperty("user_text") String userText,
        @JsonProperty("default_fields") @JsonInclude(JsonInclude.Include.NON_NULL)
        @Nullable List<String> defaultFields,
        @JsonProperty("default_operator") BooleanOperand defaultOperator,
        boolean lenient
) implements QueryAst {

    public UserInputQuery {
        Objects.requireNonNull(userText, "userText");
        defaultFields = defaultFields == null ? null : List.copyOf(defaultFields);
        if (defaultOperator == null) {
            defaultOperator = BooleanOperand.AND;
        }
    }

    /**
     * A strict query with AND as default operator and no default fields of its own.
     */
    public static UserInputQuery of(final String userText) {
        return new UserInputQuery(userText, null, BooleanOperand.AND, false);
    }

    /**
     * Parses the text. The query's own default fields win over {@code fallbackDefaultFields}.
     *
     * @param fallbackDefaultFields fields used when this query declares none
     * @param maxExpansions         expansion limit of the phrase prefix clauses produced for {@code term*}
     * @throws ParseException if the text is malformed or needs default fields and none are known
     */
    public QueryAst parse(final List<String> fallbackDefaultFields, final int maxExpansions) throws ParseException {
        final List<String> fields = defaultFields != null ? defaultFields : fallbackDefaultFields;
        return new UserQueryParser(fields, defaultOperator, lenient, maxExpansions).parse(userText);
    }

    public QueryAst parse(final List<String> fallbackDefaultFields) throws ParseException {
        return parse(fallbackDefaultFields, PhrasePrefixQuery.DEFAULT_MAX_EXPANSIONS);
    }

    @Override
    public <E extends Exception> void accept(final QueryAstVisitor<E> visitor) throws E {
        visitor.visitUserText(this);
    }
}
