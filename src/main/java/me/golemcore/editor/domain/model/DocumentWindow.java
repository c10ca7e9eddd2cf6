package me.golemcore.editor.domain.model;

/**
 * Portion of the document shown to the oracle. Windowed content carries
 * {@code N| } line-number prefixes; a full view is the raw text.
 */
public record DocumentWindow(String content, int startLine, int endLine, int totalLines, boolean moreBefore,
        boolean moreAfter) {

    public boolean isPartial() {
        return moreBefore || moreAfter;
    }
}
