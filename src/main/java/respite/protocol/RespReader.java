package respite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Resumable RESP reader for one connection.
 * <p>
 * Unlike {@link Resp#decode(ByteBuf)} this consumes bytes as soon as a header or a scalar
 * element is complete, and keeps the partially built frame (open arrays, the length of a bulk
 * body still in flight, how far the current line was already scanned) between calls. Each byte
 * is therefore examined a bounded number of times however the frame is split across reads.
 * Not thread-safe; one instance per channel.
 */
public final class RespReader {

    private static final int NOT_FOUND = -1;
    private static final int TOO_LONG = -2;

    private final Deque<PendingArray> open = new ArrayDeque<>();
    /** Body length of a bulk string whose header was consumed, or -1. */
    private long pendingBulk = -1;
    /** Bytes after the reader index already searched for CRLF. */
    private int scanned;
    /** Bytes consumed so far for the frame being read. */
    private long frameBytes;

    /**
     * Reads at most one complete top-level value, advancing the reader index past every byte
     * it has used. On {@code NEED_MORE_DATA} the bytes read so far are kept in this reader; call
     * again with the same buffer once more bytes arrive. On {@code FORMAT_ERROR} the reader is
     * reset and the caller decides what to do with the remaining bytes.
     */
    public Resp.Decoded read(ByteBuf in) {
        while (true) {
            RespValue value;
            if (pendingBulk >= 0) {
                if (in.readableBytes() < pendingBulk + 2) return Resp.Decoded.needMoreData();
                int body = in.readerIndex();
                int len = (int) pendingBulk;
                if (in.getByte(body + len) != '\r' || in.getByte(body + len + 1) != '\n') {
                    return fail("bulk string not terminated by CRLF");
                }
                if (!ByteBufUtil.isText(in, body, len, StandardCharsets.UTF_8)) {
                    return fail("invalid UTF-8 in bulk string");
                }
                value = RespValue.bulkString(in.toString(body, len, StandardCharsets.UTF_8));
                advance(in, len + 2);
                pendingBulk = -1;
            } else {
                if (!in.isReadable()) return Resp.Decoded.needMoreData();
                int start = in.readerIndex();
                byte marker = in.getByte(start);
                if (!isMarker(marker)) return fail("unexpected marker '" + printable(marker) + "'");
                int eol = findLineEnd(in);
                if (eol == TOO_LONG) return fail("line too long");
                if (eol == NOT_FOUND) return Resp.Decoded.needMoreData();
                scanned = 0;

                int lineLength = eol - start - 1;
                switch (marker) {
                    case Resp.SIMPLE_STRING:
                    case Resp.ERROR: {
                        if (!ByteBufUtil.isText(in, start + 1, lineLength, StandardCharsets.UTF_8)) {
                            return fail("invalid UTF-8 in line");
                        }
                        String text = in.toString(start + 1, lineLength, StandardCharsets.UTF_8);
                        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
                            return fail("stray CR or LF in line");
                        }
                        value = marker == Resp.SIMPLE_STRING ? RespValue.simpleString(text) : RespValue.error(text);
                        advance(in, eol + 2 - start);
                        break;
                    }
                    case Resp.INTEGER: {
                        Long n = parseLong(in, start + 1, eol);
                        if (n == null) return fail("invalid integer");
                        value = RespValue.integer(n);
                        advance(in, eol + 2 - start);
                        break;
                    }
                    case Resp.BULK_STRING: {
                        Long len = parseLong(in, start + 1, eol);
                        if (len == null || len < -1 || len > Resp.MAX_BULK_LENGTH) return fail("invalid bulk length");
                        advance(in, eol + 2 - start);
                        if (len == -1) {
                            value = RespValue.nullBulkString();
                            break;
                        }
                        pendingBulk = len;
                        continue;
                    }
                    case Resp.ARRAY: {
                        Long count = parseLong(in, start + 1, eol);
                        if (count == null || count < -1 || count > Resp.MAX_ARRAY_LENGTH) {
                            return fail("invalid multibulk length");
                        }
                        if (count > 0 && open.size() >= Resp.MAX_NESTING_DEPTH) {
                            return fail("arrays nested too deeply");
                        }
                        advance(in, eol + 2 - start);
                        if (count <= 0) {
                            value = RespValue.emptyArray();
                            break;
                        }
                        open.push(new PendingArray(count.intValue()));
                        continue;
                    }
                    default:
                        return fail("unexpected marker '" + printable(marker) + "'");
                }
            }

            // Hand the finished value to the innermost open array, closing arrays as they fill.
            while (!open.isEmpty()) {
                PendingArray top = open.peek();
                top.elements.add(value);
                if (top.elements.size() < top.count) break;
                open.pop();
                value = RespValue.array(top.elements);
            }
            if (open.isEmpty()) {
                int consumed = (int) Math.min(frameBytes, Integer.MAX_VALUE);
                frameBytes = 0;
                return Resp.Decoded.complete(value, consumed);
            }
        }
    }

    /** Drops any partially read frame. */
    public void reset() {
        open.clear();
        pendingBulk = -1;
        scanned = 0;
        frameBytes = 0;
    }

    private void advance(ByteBuf in, int n) {
        in.skipBytes(n);
        frameBytes += n;
    }

    private Resp.Decoded fail(String error) {
        reset();
        return Resp.Decoded.formatError(error);
    }

    /**
     * Index of the CR ending the line at the reader index, {@link #NOT_FOUND} when the CRLF has
     * not arrived yet, or {@link #TOO_LONG} when the line exceeds {@link Resp#MAX_LINE_LENGTH}.
     */
    private int findLineEnd(ByteBuf in) {
        int start = in.readerIndex();
        int last = in.writerIndex() - 1;
        // The marker byte is not part of the line content.
        int limit = start + 1 + Resp.MAX_LINE_LENGTH;
        for (int i = start + Math.max(1, scanned); i < last; i++) {
            if (i > limit) return TOO_LONG;
            if (in.getByte(i) == '\r' && in.getByte(i + 1) == '\n') return i;
        }
        scanned = Math.max(0, last - start);
        if (last - start > Resp.MAX_LINE_LENGTH + 1) return TOO_LONG;
        return NOT_FOUND;
    }

    private static boolean isMarker(byte b) {
        return b == Resp.SIMPLE_STRING || b == Resp.ERROR || b == Resp.INTEGER
                || b == Resp.BULK_STRING || b == Resp.ARRAY;
    }

    private static Long parseLong(ByteBuf in, int from, int to) {
        try {
            return Long.parseLong(in.toString(from, to - from, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b & 0xff);
    }

    private static final class PendingArray {
        final int count;
        final List<RespValue> elements;

        PendingArray(int count) {
            this.count = count;
            this.elements = new ArrayList<>(Math.min(count, 64));
        }
    }
}
