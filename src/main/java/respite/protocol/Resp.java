package respite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Stateless RESP decoding and encoding.
 * <p>
 * {@link #decode(ByteBuf)} reads from the buffer's reader index without moving it and reports
 * one of three outcomes: a complete value with the number of bytes it occupied, a request for
 * more data (the frame is split across reads), or a format error. Callers keep unconsumed bytes
 * and call again once more bytes arrive. Each call starts over from the first byte; connections
 * use a {@link RespReader} instead, which resumes where the previous read stopped.
 */
public final class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    /** Largest bulk string body accepted, 512 MiB like Redis' proto-max-bulk-len. */
    public static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;
    /** Largest declared element count accepted for an array. */
    public static final long MAX_ARRAY_LENGTH = 1024 * 1024;
    /** Longest header or simple string line accepted, CRLF excluded. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;
    /** Deepest array nesting accepted. */
    public static final int MAX_NESTING_DEPTH = 32;

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private Resp() {
    }

    public static final class Decoded {
        public enum Status { COMPLETE, NEED_MORE_DATA, FORMAT_ERROR }

        private static final Decoded NEED_MORE = new Decoded(Status.NEED_MORE_DATA, null, 0, null);

        private final Status status;
        private final RespValue value;
        private final int consumed;
        private final String error;

        private Decoded(Status status, RespValue value, int consumed, String error) {
            this.status = status;
            this.value = value;
            this.consumed = consumed;
            this.error = error;
        }

        public static Decoded complete(RespValue value, int consumed) {
            return new Decoded(Status.COMPLETE, value, consumed, null);
        }

        public static Decoded needMoreData() {
            return NEED_MORE;
        }

        public static Decoded formatError(String error) {
            return new Decoded(Status.FORMAT_ERROR, null, 0, error);
        }

        public Status getStatus() {
            return status;
        }

        public boolean isComplete() {
            return status == Status.COMPLETE;
        }

        public RespValue getValue() {
            return value;
        }

        public int getConsumed() {
            return consumed;
        }

        public String getError() {
            return error;
        }

        @Override
        public String toString() {
            switch (status) {
                case COMPLETE: return "Complete(" + value + ", " + consumed + ")";
                case NEED_MORE_DATA: return "NeedMoreData";
                default: return "FormatError(" + error + ")";
            }
        }
    }

    // --- PARSING ---

    public static Decoded decode(ByteBuf in) {
        return new RespReader().read(in.duplicate());
    }

    public static Decoded decode(byte[] bytes) {
        return decode(Unpooled.wrappedBuffer(bytes));
    }

    // --- SERIALIZATION ---

    public static void encode(RespValue v, ByteBuf out) {
        switch (v.getType()) {
            case SIMPLE_STRING:
            case ERROR:
                out.writeByte(v.getType().marker());
                out.writeCharSequence(v.getText(), StandardCharsets.UTF_8);
                out.writeBytes(CRLF);
                break;
            case INTEGER:
                writeHeader(out, INTEGER, v.getInteger());
                break;
            case BULK_STRING:
                byte[] b = v.bulkBytes();
                if (b == null) {
                    out.writeBytes(NULL_BULK);
                } else {
                    writeHeader(out, BULK_STRING, b.length);
                    out.writeBytes(b);
                    out.writeBytes(CRLF);
                }
                break;
            case ARRAY:
                List<RespValue> elements = v.getElements();
                writeHeader(out, ARRAY, elements.size());
                for (RespValue e : elements) {
                    encode(e, out);
                }
                break;
        }
    }

    public static byte[] encode(RespValue v) {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(v, buf);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    private static void writeHeader(ByteBuf out, char marker, long n) {
        out.writeByte(marker);
        out.writeCharSequence(Long.toString(n), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
