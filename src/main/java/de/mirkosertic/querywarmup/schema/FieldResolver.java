package de.mirkosertic.querywarmup.schema;

import de.mirkosertic.querywarmup.FieldDoesNotExistException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves user facing, possibly dotted field names against a {@link Schema}.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>exact match against a declared field,</li>
 *   <li>the longest dotted prefix naming a JSON field, the remainder being the JSON path,</li>
 *   <li>the dynamic JSON field, with the whole name as path (unless disabled),</li>
 *   <li>otherwise {@link FieldDoesNotExistException}.</li>
 * </ol>
 * JSON paths are not validated: keys are only known when documents are evaluated.
 * A dot preceded by a backslash is part of a name segment.
 */
public final class FieldResolver {

    private FieldResolver() {
    }

    public static ResolvedField resolve(final String name, final Schema schema) throws FieldDoesNotExistException {
        return resolve(name, schema, true);
    }

    public static ResolvedField resolve(final String name, final Schema schema, final boolean allowDynamic)
            throws FieldDoesNotExistException {
        final List<String> segments = splitPath(name);
        if (segments.isEmpty()) {
            throw new FieldDoesNotExistException(name);
        }

        for (int prefixLength = segments.size(); prefixLength > 0; prefixLength--) {
            final String candidate = String.join(".", segments.subList(0, prefixLength));
            final Optional<Field> field = schema.getField(candidate);
            if (field.isEmpty()) {
                continue;
            }
            final FieldEntry entry = schema.getFieldEntry(field.get());
            if (prefixLength == segments.size()) {
                return new ResolvedField(field.get(), entry, "");
            }
            if (entry.type() == FieldType.JSON) {
                final String path = String.join(".", segments.subList(prefixLength, segments.size()));
                return new ResolvedField(field.get(), entry, path);
            }
        }

        if (allowDynamic) {
            final Optional<Field> dynamicField = schema.dynamicField();
            if (dynamicField.isPresent()) {
                return new ResolvedField(dynamicField.get(), schema.getFieldEntry(dynamicField.get()),
                        String.join(".", segments));
            }
        }
        throw new FieldDoesNotExistException(name);
    }

    /**
     * Lenient probe: whether the named field resolves to a fast field. Unknown names are not fast.
     */
    public static boolean isFast(final Schema schema, final String name) {
        try {
            return resolve(name, schema).entry().fast();
        } catch (final FieldDoesNotExistException e) {
            return false;
        }
    }

    /**
     * Lenient probe: whether a presence check on the named field reads its doc values. Unknown
     * names do not.
     */
    public static boolean hasColumnarPresence(final Schema schema, final String name) {
        try {
            return resolve(name, schema).hasColumnarPresence();
        } catch (final FieldDoesNotExistException e) {
            return false;
        }
    }

    /**
     * Splits a field name on dots that are not escaped with a backslash and unescapes each segment.
     */
    static List<String> splitPath(final String name) {
        final List<String> segments = new ArrayList<>();
        if (name == null || name.isEmpty()) {
            return segments;
        }
        final StringBuilder current = new StringBuilder();
        boolean escaped = false;
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '.') {
                segments.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (escaped) {
            current.append('\\');
        }
        segments.add(current.toString());
        return segments;
    }
}
