package com.ijawAudio.translator.lexicon.model;

/**
 * One row of a role-tagged lexicon table.
 *
 * @param englishForm lower-cased, trimmed English form
 * @param targetForm Ijaw rendering
 * @param role role of the table the entry belongs to
 */
public record LexicalEntry(String englishForm, String targetForm, WordRole role) {
}
