package ch.so.arp.assistant.retrieval;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits extracted document text into overlapping windows of fixed size. The
 * returned sequences are lazy and can be iterated any number of times.
 */
public class TextChunker {

    public static final int DEFAULT_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    private final int size;
    private final int overlap;

    public TextChunker() {
        this(DEFAULT_SIZE, DEFAULT_OVERLAP);
    }

    public TextChunker(int size, int overlap) {
        validate(size, overlap);
        this.size = size;
        this.overlap = overlap;
    }

    public Iterable<String> chunk(String text) {
        return chunk(text, size, overlap);
    }

    /**
     * Chunks start every {@code size - overlap} characters until the text is
     * exhausted; the last chunk may be shorter than {@code size}.
     *
     * @throws IllegalArgumentException if {@code size} is not positive or the
     *                                  overlap is negative or not smaller than size
     */
    public static Iterable<String> chunk(String text, int size, int overlap) {
        validate(size, overlap);
        String source = text == null ? "" : text;
        int step = size - overlap;
        return () -> new Iterator<>() {

            private int start;

            @Override
            public boolean hasNext() {
                return start < source.length();
            }

            @Override
            public String next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                String chunk = source.substring(start, Math.min(start + size, source.length()));
                start += step;
                return chunk;
            }
        };
    }

    public int getSize() {
        return size;
    }

    public int getOverlap() {
        return overlap;
    }

    private static void validate(int size, int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("chunk size must be positive but was " + size);
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException(
                    "chunk overlap must be between 0 and size - 1 but was " + overlap + " (size " + size + ")");
        }
    }
}
