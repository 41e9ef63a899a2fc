package com.splitttr.coedit.session;

import com.splitttr.coedit.message.Mutation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Text and mutation history of one document. Not thread-safe; owned by a single
 * {@link DocumentSession} and only touched under its lock.
 *
 * <p>{@code content} always equals {@code baseContent} with every history entry
 * applied in order. When a history limit is set, the oldest entries are folded into
 * {@code baseContent} as they fall out of the window.
 */
class DocumentState {

    private final int historyLimit;
    private final Deque<Mutation> history = new ArrayDeque<>();

    private String baseContent;
    private String content;
    private long version;

    DocumentState(String initialContent, int historyLimit) {
        this.baseContent = initialContent == null ? "" : initialContent;
        this.content = this.baseContent;
        this.historyLimit = Math.max(historyLimit, 0);
    }

    String content() {
        return content;
    }

    String baseContent() {
        return baseContent;
    }

    long version() {
        return version;
    }

    List<Mutation> history() {
        return List.copyOf(history);
    }

    /**
     * @return null when {@code mutation} applies cleanly to the current content,
     *         otherwise the reason it does not
     */
    String checkPrecondition(Mutation mutation) {
        if (mutation.kind() == null) {
            return "Mutation kind is required";
        }
        int length = content.length();
        int position = mutation.position();
        if (position < 0 || position > length) {
            return "Position " + position + " is outside the document (length " + length + ")";
        }
        return switch (mutation.kind()) {
            case INSERT -> mutation.deletedText().isEmpty() ? null : "Insert must not carry deleted text";
            case DELETE -> mutation.deletedText().isEmpty()
                ? "Delete requires the text being deleted"
                : checkExpected(mutation);
            case REPLACE -> checkExpected(mutation);
        };
    }

    private String checkExpected(Mutation mutation) {
        String expected = mutation.deletedText();
        int position = mutation.position();
        if (content.startsWith(expected, position)) {
            return null;
        }
        int end = Math.min(content.length(), position + expected.length());
        return "Expected \"" + expected + "\" at position " + position
            + " but found \"" + content.substring(position, end) + "\"";
    }

    /**
     * Applies a mutation whose precondition has already been checked.
     */
    void apply(Mutation mutation) {
        content = mutation.applyTo(content);
        history.addLast(mutation);
        version++;
        if (historyLimit > 0) {
            while (history.size() > historyLimit) {
                baseContent = history.removeFirst().applyTo(baseContent);
            }
        }
    }

    static String replay(String base, Iterable<Mutation> mutations) {
        String result = base;
        for (Mutation m : mutations) {
            result = m.applyTo(result);
        }
        return result;
    }
}
