package com.ragsync.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits normalized text into ordered, bounded chunks that repeat the tail of the
 * previous chunk as context. Output depends only on the content and the two limits.
 */
public class Chunker {
    static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n{2,}");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[。.！!？?])");

    private final int maxChars;
    private final int overlapChars;

    public Chunker(int maxChars, int overlapChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        if (overlapChars < 0 || overlapChars >= maxChars) {
            throw new IllegalArgumentException("overlapChars must be >= 0 and < maxChars");
        }
        this.maxChars = maxChars;
        this.overlapChars = overlapChars;
    }

    public List<Chunk> chunk(String content) {
        List<String> texts = chunkTexts(content);
        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            chunks.add(new Chunk(i, text, ContentHasher.sha1(text)));
        }
        return chunks;
    }

    public int maxChars() {
        return maxChars;
    }

    public int overlapChars() {
        return overlapChars;
    }

    List<String> chunkTexts(String content) {
        String text = TextCleaner.clean(content);
        if (text.isEmpty()) {
            return List.of();
        }

        List<String> pieces = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String stripped = paragraph.strip();
            if (!stripped.isEmpty()) {
                pieces.addAll(splitLongParagraph(stripped));
            }
        }

        List<String> chunks = new ArrayList<>();
        String buffer = "";
        for (String piece : pieces) {
            if (buffer.isEmpty()) {
                buffer = piece;
                continue;
            }
            if (buffer.length() + PARAGRAPH_SEPARATOR.length() + piece.length() <= maxChars) {
                buffer = buffer + PARAGRAPH_SEPARATOR + piece;
                continue;
            }
            chunks.add(buffer);
            buffer = startSeededChunk(buffer, piece);
        }
        if (!buffer.isEmpty()) {
            chunks.add(buffer);
        }

        return chunks.stream()
                .filter(chunk -> !TextCleaner.clean(chunk).isEmpty())
                .toList();
    }

    List<String> splitLongParagraph(String paragraph) {
        if (paragraph.length() <= maxChars) {
            return List.of(paragraph);
        }

        List<String> groups = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (String segment : SENTENCE_END.split(paragraph)) {
            if (segment.isBlank()) {
                continue;
            }
            if (buffer.length() == 0) {
                buffer.append(segment.stripLeading());
            } else if (buffer.length() + segment.length() <= maxChars) {
                buffer.append(segment);
            } else {
                groups.add(buffer.toString().strip());
                buffer.setLength(0);
                buffer.append(segment.stripLeading());
            }
        }
        if (buffer.length() > 0) {
            groups.add(buffer.toString().strip());
        }

        List<String> out = new ArrayList<>();
        for (String group : groups) {
            if (group.length() <= maxChars) {
                out.add(group);
                continue;
            }
            int start = 0;
            while (start < group.length()) {
                int end = sliceEnd(group, start, Math.min(group.length(), start + maxChars));
                out.add(group.substring(start, end));
                start = end;
            }
        }
        return out;
    }

    // Never ends a slice between the two halves of a surrogate pair.
    private static int sliceEnd(String text, int start, int end) {
        if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            return end - 1 > start ? end - 1 : end + 1;
        }
        return end;
    }

    // The piece is kept whole; only the seed gives way when both do not fit.
    private String startSeededChunk(String previous, String piece) {
        String seed = overlapSeed(previous, maxChars - PARAGRAPH_SEPARATOR.length() - piece.length());
        return seed.isEmpty() ? piece : seed + PARAGRAPH_SEPARATOR + piece;
    }

    private String overlapSeed(String previous, int room) {
        if (overlapChars == 0 || previous.length() <= overlapChars) {
            return "";
        }
        int seedLength = Math.min(overlapChars, room);
        if (seedLength <= 0) {
            return "";
        }
        int start = previous.length() - seedLength;
        if (Character.isLowSurrogate(previous.charAt(start)) && Character.isHighSurrogate(previous.charAt(start - 1))) {
            start++;
        }
        return previous.substring(start);
    }
}
