package de.mirkosertic.querywarmup.schema;

import de.mirkosertic.querywarmup.InvalidQueryException;
import org.apache.lucene.document.InetAddressPoint;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.NumericUtils;
import org.jspecify.annotations.Nullable;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Byte encoding of field values, shared by the query compiler and the document mapper so that
 * query terms and indexed terms compare byte for byte.
 *
 * <ul>
 *   <li>u64, i64, f64, bool and datetime values become a sortable {@code long} (the doc value),
 *       whose 8 byte sortable big-endian form is the term.</li>
 *   <li>ip addresses become their 16 byte IPv6 form, IPv4 addresses mapped.</li>
 *   <li>json terms are the path, {@link #JSON_END_OF_PATH}, a type code and the value bytes.</li>
 * </ul>
 */
public final class TermEncoder {

    public static final byte JSON_END_OF_PATH = 0;
    public static final byte JSON_TYPE_STR = 's';
    public static final byte JSON_TYPE_U64 = 'u';
    public static final byte JSON_TYPE_I64 = 'i';
    public static final byte JSON_TYPE_F64 = 'f';
    public static final byte JSON_TYPE_BOOL = 'o';

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private TermEncoder() {
    }

    /**
     * Converts a value of a numeric field (u64, i64, f64, bool, datetime) to its sortable doc value.
     */
    public static long toSortableLong(final FieldEntry entry, final String value) throws InvalidQueryException {
        return switch (entry.type()) {
            case U64 -> parseU64(entry.name(), value) ^ Long.MIN_VALUE;
            case I64 -> parseI64(entry.name(), value);
            case F64 -> NumericUtils.doubleToSortableLong(parseF64(entry.name(), value));
            case BOOL -> parseBool(entry.name(), value) ? 1L : 0L;
            case DATETIME -> entry.precision().truncate(parseDatetimeMicros(entry.name(), value));
            default -> throw new IllegalArgumentException("Not a numeric field: " + entry.name());
        };
    }

    /**
     * Encodes a value of a non text, non json field as term bytes.
     */
    public static BytesRef encodeValue(final FieldEntry entry, final String value) throws InvalidQueryException {
        if (entry.type() == FieldType.IP_ADDR) {
            return ipBytes(parseIp(entry.name(), value));
        }
        return sortableBytes(toSortableLong(entry, value));
    }

    public static BytesRef sortableBytes(final long sortableValue) {
        final byte[] bytes = new byte[Long.BYTES];
        NumericUtils.longToSortableBytes(sortableValue, bytes, 0);
        return new BytesRef(bytes);
    }

    public static BytesRef ipBytes(final InetAddress address) {
        return new BytesRef(InetAddressPoint.encode(address));
    }

    /**
     * Frames a value of a JSON field: path, end of path marker, type code, value.
     */
    public static BytesRef jsonTerm(final String path, final byte typeCode, final BytesRef value) {
        final BytesRefBuilder builder = new BytesRefBuilder();
        builder.append(new BytesRef(path));
        builder.append(JSON_END_OF_PATH);
        builder.append(typeCode);
        builder.append(value);
        return builder.toBytesRef();
    }

    /**
     * Frames a string value of a JSON field.
     */
    public static BytesRef jsonStringTerm(final String path, final String text) {
        return jsonTerm(path, JSON_TYPE_STR, new BytesRef(text.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Frames a number or boolean value found in a JSON document.
     *
     * @throws IllegalArgumentException for other value kinds
     */
    public static BytesRef jsonValueTerm(final String path, final Object value) {
        if (value instanceof Boolean bool) {
            return jsonTerm(path, JSON_TYPE_BOOL, sortableBytes(bool ? 1L : 0L));
        }
        if (value instanceof Double || value instanceof Float) {
            return jsonTerm(path, JSON_TYPE_F64,
                    sortableBytes(NumericUtils.doubleToSortableLong(((Number) value).doubleValue())));
        }
        if (value instanceof BigInteger big) {
            final BytesRef term = jsonIntegerTerm(path, big);
            if (term == null) {
                throw new IllegalArgumentException("JSON integer out of 64 bit range: " + value);
            }
            return term;
        }
        if (value instanceof Number number) {
            return jsonTerm(path, JSON_TYPE_I64, sortableBytes(number.longValue()));
        }
        throw new IllegalArgumentException("Not a JSON number or boolean: " + value);
    }

    /**
     * The typed JSON terms a query literal may match besides its string form: an integer, a
     * floating point number or a boolean, depending on what the literal looks like.
     */
    public static List<BytesRef> jsonLiteralTerms(final String path, final String literal) {
        final String trimmed = literal.trim();
        final List<BytesRef> terms = new ArrayList<>(1);
        if (INTEGER.matcher(trimmed).matches()) {
            final BytesRef integer = jsonIntegerTerm(path, new BigInteger(trimmed));
            if (integer != null) {
                terms.add(integer);
            }
        } else if (DECIMAL.matcher(trimmed).matches()) {
            terms.add(jsonTerm(path, JSON_TYPE_F64,
                    sortableBytes(NumericUtils.doubleToSortableLong(Double.parseDouble(trimmed)))));
        } else if ("true".equals(trimmed) || "false".equals(trimmed)) {
            terms.add(jsonTerm(path, JSON_TYPE_BOOL, sortableBytes("true".equals(trimmed) ? 1L : 0L)));
        }
        return terms;
    }

    /**
     * i64 if the value fits, u64 above that, nothing if it fits neither.
     */
    private static @Nullable BytesRef jsonIntegerTerm(final String path, final BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return jsonTerm(path, JSON_TYPE_I64, sortableBytes(value.longValue()));
        }
        if (value.signum() > 0 && value.bitLength() == Long.SIZE) {
            return jsonTerm(path, JSON_TYPE_U64, sortableBytes(value.longValue() ^ Long.MIN_VALUE));
        }
        return null;
    }

    public static long parseU64(final String fieldName, final String value) throws InvalidQueryException {
        try {
            return Long.parseUnsignedLong(value.trim());
        } catch (final NumberFormatException e) {
            throw InvalidQueryException.expectedValueType("u64", fieldName, value);
        }
    }

    public static long parseI64(final String fieldName, final String value) throws InvalidQueryException {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw InvalidQueryException.expectedValueType("i64", fieldName, value);
        }
    }

    public static double parseF64(final String fieldName, final String value) throws InvalidQueryException {
        try {
            final double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed)) {
                throw InvalidQueryException.expectedValueType("f64", fieldName, value);
            }
            return parsed;
        } catch (final NumberFormatException e) {
            throw InvalidQueryException.expectedValueType("f64", fieldName, value);
        }
    }

    public static boolean parseBool(final String fieldName, final String value) throws InvalidQueryException {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw InvalidQueryException.expectedValueType("bool", fieldName, value);
        };
    }

    /**
     * Parses an RFC 3339 timestamp into microseconds since epoch.
     */
    public static long parseDatetimeMicros(final String fieldName, final String value) throws InvalidQueryException {
        try {
            final Instant instant = OffsetDateTime.parse(value.trim()).toInstant();
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
        } catch (final DateTimeParseException | ArithmeticException e) {
            throw InvalidQueryException.expectedValueType("datetime", fieldName, value);
        }
    }

    /**
     * Parses an IP address literal. Host names are rejected, no name lookup ever happens.
     */
    public static InetAddress parseIp(final String fieldName, final String value) throws InvalidQueryException {
        final String literal = value.trim();
        final var matcher = IPV4.matcher(literal);
        if (matcher.matches()) {
            for (int group = 1; group <= 4; group++) {
                if (Integer.parseInt(matcher.group(group)) > 255) {
                    throw InvalidQueryException.expectedValueType("ip", fieldName, value);
                }
            }
        } else if (!literal.contains(":")) {
            throw InvalidQueryException.expectedValueType("ip", fieldName, value);
        }
        try {
            return InetAddress.getByName(literal);
        } catch (final UnknownHostException e) {
            throw InvalidQueryException.expectedValueType("ip", fieldName, value);
        }
    }
}
