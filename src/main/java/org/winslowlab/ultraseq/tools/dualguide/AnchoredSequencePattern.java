package org.winslowlab.ultraseq.tools.dualguide;

import org.winslowlab.ultraseq.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A read structure made of fixed anchors and bounded-length captures, for example
 * {@code TAGTT(.{16})TATGG(.{16,21})GTTTA}.
 * <p>
 * The grammar is a sequence of literal characters (anything but parentheses, dots and braces) and capture groups written
 * {@code (.{n})} or {@code (.{m,n})} with {@code 0 <= m <= n}. Literals are matched case-sensitively.
 * </p>
 * <p>
 * {@link #search} returns the match starting at the leftmost possible position. At a given start, variable-length
 * captures take the longest length that still lets the rest of the structure match, which gives the same
 * captures as a regular expression search with greedy quantifiers.
 * </p>
 */
public final class AnchoredSequencePattern {

    private final String structure;
    private final List<Element> elements;
    private final int captureCount;

    /**
     * The shortest sequence that can match, used to bound the start positions tried.
     */
    private final int minimumLength;

    private AnchoredSequencePattern(final String structure, final List<Element> elements) {
        this.structure = structure;
        this.elements = Collections.unmodifiableList(elements);
        this.captureCount = (int) elements.stream().filter(e -> e instanceof Capture).count();
        this.minimumLength = elements.stream().mapToInt(Element::minimumLength).sum();
    }

    /**
     * Parses a read structure.
     *
     * @param structure the structure, cannot be {@code null} or empty.
     * @return never {@code null}.
     * @throws IllegalArgumentException if the structure is not valid.
     */
    public static AnchoredSequencePattern compile(final String structure) {
        Utils.nonEmpty(structure, "the read structure cannot be empty");
        final List<Element> elements = new ArrayList<>();
        final StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < structure.length()) {
            final char c = structure.charAt(i);
            if (c == ')') {
                throw invalid(structure, i, "unbalanced ')'");
            } else if (c == '.' || c == '{' || c == '}') {
                throw invalid(structure, i, "'" + c + "' is only allowed inside a capture");
            } else if (c != '(') {
                literal.append(c);
                i++;
                continue;
            }
            if (literal.length() > 0) {
                elements.add(new Literal(literal.toString()));
                literal.setLength(0);
            }
            final int close = structure.indexOf(')', i);
            if (close < 0) {
                throw invalid(structure, i, "unbalanced '('");
            }
            elements.add(parseCapture(structure, i, structure.substring(i + 1, close)));
            i = close + 1;
        }
        if (literal.length() > 0) {
            elements.add(new Literal(literal.toString()));
        }
        return new AnchoredSequencePattern(structure, elements);
    }

    private static Capture parseCapture(final String structure, final int offset, final String body) {
        if (!body.startsWith(".{") || !body.endsWith("}")) {
            throw invalid(structure, offset, "a capture must be written (.{n}) or (.{m,n})");
        }
        final String bounds = body.substring(2, body.length() - 1);
        final String[] parts = bounds.split(",", -1);
        if (parts.length > 2) {
            throw invalid(structure, offset, "too many bounds in capture");
        }
        try {
            final int min = Integer.parseInt(parts[0].trim());
            final int max = parts.length == 1 ? min : Integer.parseInt(parts[1].trim());
            if (min < 0 || max < min) {
                throw invalid(structure, offset, String.format("invalid capture bounds {%d,%d}", min, max));
            }
            return new Capture(min, max);
        } catch (final NumberFormatException e) {
            throw invalid(structure, offset, "capture bounds must be integers: " + bounds);
        }
    }

    private static IllegalArgumentException invalid(final String structure, final int offset, final String message) {
        return new IllegalArgumentException(String.format("invalid read structure '%s' at position %d: %s", structure, offset, message));
    }

    public int getCaptureCount() {
        return captureCount;
    }

    /**
     * Finds the leftmost match of this structure in a sequence.
     *
     * @param sequence the sequence to search, cannot be {@code null}.
     * @return empty if the structure does not occur in the sequence.
     */
    public Optional<Match> search(final CharSequence sequence) {
        Utils.nonNull(sequence, "the sequence cannot be null");
        final int[] captureBounds = new int[captureCount * 2];
        for (int start = 0; start + minimumLength <= sequence.length(); start++) {
            final int end = matchFrom(sequence, 0, start, 0, captureBounds);
            if (end >= 0) {
                final String[] captures = new String[captureCount];
                for (int c = 0; c < captureCount; c++) {
                    captures[c] = sequence.subSequence(captureBounds[2 * c], captureBounds[2 * c + 1]).toString();
                }
                return Optional.of(new Match(start, end, captures));
            }
        }
        return Optional.empty();
    }

    /**
     * Matches elements from {@code elementIndex} onwards at {@code position}.
     *
     * @return the end of the match, or -1 if there is none.
     */
    private int matchFrom(final CharSequence sequence, final int elementIndex, final int position,
                          final int captureIndex, final int[] captureBounds) {
        if (elementIndex == elements.size()) {
            return position;
        }
        final Element element = elements.get(elementIndex);
        if (element instanceof Literal) {
            final String anchor = ((Literal) element).bases;
            if (!regionMatches(sequence, position, anchor)) {
                return -1;
            }
            return matchFrom(sequence, elementIndex + 1, position + anchor.length(), captureIndex, captureBounds);
        }
        final Capture capture = (Capture) element;
        final int available = sequence.length() - position;
        for (int length = Math.min(capture.max, available); length >= capture.min; length--) {
            captureBounds[2 * captureIndex] = position;
            captureBounds[2 * captureIndex + 1] = position + length;
            final int end = matchFrom(sequence, elementIndex + 1, position + length, captureIndex + 1, captureBounds);
            if (end >= 0) {
                return end;
            }
        }
        return -1;
    }

    private static boolean regionMatches(final CharSequence sequence, final int offset, final String anchor) {
        if (offset + anchor.length() > sequence.length()) {
            return false;
        }
        for (int i = 0; i < anchor.length(); i++) {
            if (sequence.charAt(offset + i) != anchor.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return structure;
    }

    /**
     * A successful search: the matched region and the captured subsequences.
     */
    public static final class Match {
        private final int start;
        private final int end;
        private final String[] captures;

        private Match(final int start, final int end, final String[] captures) {
            this.start = start;
            this.end = end;
            this.captures = captures;
        }

        public int getStart() {
            return start;
        }

        /**
         * @return the position right after the match.
         */
        public int getEnd() {
            return end;
        }

        /**
         * Returns a captured subsequence; captures are numbered from 1 in structure order.
         */
        public String group(final int index) {
            Utils.validateArg(index >= 1 && index <= captures.length, () -> "no such capture: " + index);
            return captures[index - 1];
        }

        public List<String> groups() {
            return Collections.unmodifiableList(Arrays.asList(captures));
        }
    }

    private interface Element {
        int minimumLength();
    }

    private static final class Literal implements Element {
        private final String bases;

        private Literal(final String bases) {
            this.bases = bases;
        }

        @Override
        public int minimumLength() {
            return bases.length();
        }
    }

    private static final class Capture implements Element {
        private final int min;
        private final int max;

        private Capture(final int min, final int max) {
            this.min = min;
            this.max = max;
        }

        @Override
        public int minimumLength() {
            return min;
        }
    }
}
