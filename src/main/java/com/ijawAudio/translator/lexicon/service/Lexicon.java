package com.ijawAudio.translator.lexicon.service;

import com.ijawAudio.translator.lexicon.IjawWordTables;
import com.ijawAudio.translator.lexicon.model.PhraseDictionary;
import com.ijawAudio.translator.lexicon.model.RoleTable;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide lexicon state: compiled-in role tables plus the current phrase dictionary snapshot.
 *
 * Readers take a {@link LexiconSnapshot} per request and never see a partially applied update.
 * Writers build a new {@link PhraseDictionary} and swap the reference atomically.
 */
@Slf4j
public class Lexicon {

    private final List<RoleTable> roleTables;
    private final AtomicReference<LexiconSnapshot> current;

    Lexicon(PhraseDictionary phraseDictionary, List<RoleTable> roleTables) {
        this.roleTables = List.copyOf(roleTables);
        this.current = new AtomicReference<>(new LexiconSnapshot(phraseDictionary, this.roleTables));
    }

    /**
     * Builds the lexicon from the phrase dictionary data and the compiled-in role tables.
     *
     * @param phraseDictionary English phrase to Ijaw text
     * @return Initialized lexicon
     * @throws com.ijawAudio.translator.lexicon.exception.InvalidLexiconException if the data is not a valid mapping
     */
    public static Lexicon load(Map<String, String> phraseDictionary) {
        Lexicon lexicon = new Lexicon(PhraseDictionary.of(phraseDictionary), IjawWordTables.ROLE_TABLES);
        log.info("Lexicon loaded - phrases: {}, pronouns: {}, verbs: {}, nouns: {}, adjectives: {}",
                lexicon.snapshot().phraseDictionary().size(),
                IjawWordTables.PRONOUNS.size(),
                IjawWordTables.VERBS.size(),
                IjawWordTables.NOUNS.size(),
                IjawWordTables.ADJECTIVES.size());
        return lexicon;
    }

    public LexiconSnapshot snapshot() {
        return current.get();
    }

    /**
     * Swaps in a prebuilt phrase dictionary. Callers build it from {@link #snapshot()} and
     * publish only once the change is durable.
     *
     * @return The snapshot that now serves lookups
     */
    public LexiconSnapshot publish(PhraseDictionary phraseDictionary) {
        LexiconSnapshot updated = new LexiconSnapshot(phraseDictionary, roleTables);
        current.set(updated);
        log.debug("Phrase dictionary updated - entries: {}", updated.phraseDictionary().size());
        return updated;
    }
}
