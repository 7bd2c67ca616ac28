package org.javai.dialogs.prompt;

/**
 * A choice picked from a {@link ChoicePrompt}.
 *
 * @param index zero-based position in the offered choices
 * @param value the offered choice text
 */
public record FoundChoice(int index, String value) {
}
