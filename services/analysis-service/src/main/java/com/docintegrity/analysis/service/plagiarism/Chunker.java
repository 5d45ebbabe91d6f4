package com.docintegrity.analysis.service.plagiarism;

import com.docintegrity.analysis.domain.Chunk;
import com.docintegrity.analysis.service.text.SentenceSplitter;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits normalized text into consecutive, non-overlapping chunks of at most
 * {@code maxChunkChars} characters.
 *
 * <p>A chunk ends at the last sentence start that keeps it at least {@code minChunkChars} long;
 * failing that, right after the last whitespace before the limit; failing that, at the limit.
 * Joining every chunk's text in order gives back the input exactly. Apart from the final chunk,
 * a chunk is only shorter than {@code minChunkChars} when an unbroken token forces the cut.</p>
 */
public class Chunker {

    private final int minChunkChars;
    private final int maxChunkChars;

    public Chunker(int minChunkChars, int maxChunkChars) {
        if (minChunkChars < 1 || maxChunkChars < minChunkChars) {
            throw new IllegalArgumentException(
                "Chunk bounds must satisfy 1 <= min <= max, got [" + minChunkChars + ", " + maxChunkChars + "]");
        }
        this.minChunkChars = minChunkChars;
        this.maxChunkChars = maxChunkChars;
    }

    public int getMinChunkChars() {
        return minChunkChars;
    }

    public int getMaxChunkChars() {
        return maxChunkChars;
    }

    public Stream<Chunk> chunks(String text) {
        Spliterator<Chunk> spliterator = Spliterators.spliteratorUnknownSize(
            new ChunkIterator(text),
            Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE
        );
        return StreamSupport.stream(spliterator, false);
    }

    public List<Chunk> split(String text) {
        return chunks(text).toList();
    }

    private final class ChunkIterator implements Iterator<Chunk> {

        private final String text;
        private final int[] sentenceStarts;
        private int position;
        private int index;

        private ChunkIterator(String text) {
            this.text = text;
            this.sentenceStarts = SentenceSplitter.split(text).stream()
                .mapToInt(SentenceSplitter.Span::start)
                .filter(start -> start > 0)
                .toArray();
        }

        @Override
        public boolean hasNext() {
            return position < text.length();
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int start = position;
            int end = nextEnd(start);
            position = end;
            return new Chunk(index++, text.substring(start, end), start, end);
        }

        private int nextEnd(int start) {
            if (text.length() - start <= maxChunkChars) {
                return text.length();
            }
            int limit = start + maxChunkChars;

            int boundary = lastSentenceStartAtOrBefore(limit);
            if (boundary >= start + minChunkChars) {
                return boundary;
            }
            for (int i = limit - 1; i > start; i--) {
                if (Character.isWhitespace(text.charAt(i))) {
                    return i + 1;
                }
            }
            if (Character.isHighSurrogate(text.charAt(limit - 1)) && limit - 1 > start) {
                return limit - 1;
            }
            return limit;
        }

        private int lastSentenceStartAtOrBefore(int limit) {
            int found = Arrays.binarySearch(sentenceStarts, limit);
            if (found >= 0) {
                return sentenceStarts[found];
            }
            int insertion = -found - 1;
            return insertion == 0 ? -1 : sentenceStarts[insertion - 1];
        }
    }
}
