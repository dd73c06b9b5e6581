package respite.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One RESP value: simple string, error, integer, bulk string or array.
 * Instances are immutable. A bulk string without text is the wire null bulk string.
 */
public final class RespValue {

    public enum Type {
        SIMPLE_STRING(Resp.SIMPLE_STRING),
        ERROR(Resp.ERROR),
        INTEGER(Resp.INTEGER),
        BULK_STRING(Resp.BULK_STRING),
        ARRAY(Resp.ARRAY);

        private final char marker;

        Type(char marker) {
            this.marker = marker;
        }

        public char marker() {
            return marker;
        }
    }

    private static final RespValue NULL_BULK = new RespValue(Type.BULK_STRING, null, 0, null);
    private static final RespValue EMPTY_ARRAY = new RespValue(Type.ARRAY, null, 0, Collections.emptyList());
    private static final RespValue OK = new RespValue(Type.SIMPLE_STRING, "OK", 0, null);

    private final Type type;
    private final String text;
    private final long number;
    private final List<RespValue> elements;

    private RespValue(Type type, String text, long number, List<RespValue> elements) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.elements = elements;
    }

    public static RespValue simpleString(String s) {
        return new RespValue(Type.SIMPLE_STRING, requireLine(s), 0, null);
    }

    public static RespValue ok() {
        return OK;
    }

    public static RespValue error(String s) {
        return new RespValue(Type.ERROR, requireLine(s), 0, null);
    }

    public static RespValue integer(long i) {
        return new RespValue(Type.INTEGER, null, i, null);
    }

    public static RespValue bulkString(String s) {
        if (s == null) return NULL_BULK;
        return new RespValue(Type.BULK_STRING, s, 0, null);
    }

    public static RespValue nullBulkString() {
        return NULL_BULK;
    }

    public static RespValue array(List<RespValue> elements) {
        if (elements == null || elements.isEmpty()) return EMPTY_ARRAY;
        for (RespValue e : elements) {
            Objects.requireNonNull(e, "array element");
        }
        return new RespValue(Type.ARRAY, null, 0, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static RespValue array(RespValue... elements) {
        return array(List.of(elements));
    }

    public static RespValue emptyArray() {
        return EMPTY_ARRAY;
    }

    /** Builds an array of bulk strings, the shape every client request takes. */
    public static RespValue command(String... parts) {
        List<RespValue> list = new ArrayList<>(parts.length);
        for (String p : parts) list.add(bulkString(p));
        return array(list);
    }

    private static String requireLine(String s) {
        Objects.requireNonNull(s, "text");
        if (s.indexOf('\r') >= 0 || s.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("simple strings and errors cannot contain CR or LF");
        }
        return s;
    }

    public Type getType() {
        return type;
    }

    public boolean isNull() {
        return type == Type.BULK_STRING && text == null;
    }

    /** Text of a simple string, error or bulk string; null for the null bulk string. */
    public String getText() {
        if (type == Type.INTEGER || type == Type.ARRAY) {
            throw new IllegalStateException(type + " has no text");
        }
        return text;
    }

    public long getInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException(type + " is not an integer");
        return number;
    }

    public List<RespValue> getElements() {
        if (type != Type.ARRAY) throw new IllegalStateException(type + " is not an array");
        return elements;
    }

    /** UTF-8 payload of a bulk string, as counted by its length prefix. */
    byte[] bulkBytes() {
        return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespValue)) return false;
        RespValue other = (RespValue) o;
        return type == other.type
                && number == other.number
                && Objects.equals(text, other.text)
                && Objects.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number, elements);
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE_STRING: return "+" + text;
            case ERROR: return "-" + text;
            case INTEGER: return ":" + number;
            case BULK_STRING: return text == null ? "(nil)" : "\"" + text + "\"";
            default: return elements.toString();
        }
    }
}
