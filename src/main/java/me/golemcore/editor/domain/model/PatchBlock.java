package me.golemcore.editor.domain.model;

/**
 * One search/replace pair of a patch, in declaration order.
 */
public record PatchBlock(String search, String replace) {
}
