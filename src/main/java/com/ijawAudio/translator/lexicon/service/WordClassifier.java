package com.ijawAudio.translator.lexicon.service;

import com.ijawAudio.translator.lexicon.ClosedWordClasses;
import com.ijawAudio.translator.lexicon.IjawWordTables;
import com.ijawAudio.translator.lexicon.model.RoleTable;
import com.ijawAudio.translator.lexicon.model.WordRole;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Word classifier service.
 *
 * Responsibilities:
 * - Resolve a token to exactly one {@link WordRole}
 * - Apply the fixed precedence: pronoun, verb, noun, adjective, determiner, preposition
 * - Fall back to {@link WordRole#UNKNOWN}, never throw
 *
 * Only the compiled-in role tables are consulted; the phrase dictionary carries no roles.
 */
@Service
public class WordClassifier {

    private final List<RoleTable> roleTables = IjawWordTables.ROLE_TABLES;

    /**
     * Classifies a token. The token is expected lower-cased already but is normalized again.
     *
     * @param token English token
     * @return Lexical role of the token
     */
    public WordRole classify(String token) {
        String key = TextNormalizer.normalize(token);
        for (RoleTable table : roleTables) {
            if (table.contains(key)) {
                return table.role();
            }
        }
        if (ClosedWordClasses.DETERMINERS.contains(key)) {
            return WordRole.DETERMINER;
        }
        if (ClosedWordClasses.PREPOSITIONS.contains(key)) {
            return WordRole.PREPOSITION;
        }
        return WordRole.UNKNOWN;
    }

    /**
     * Returns true if the token is listed in the adjective table.
     */
    public boolean isAdjective(String token) {
        return classify(token) == WordRole.ADJECTIVE;
    }
}
