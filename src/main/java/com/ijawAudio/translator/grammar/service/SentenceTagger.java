package com.ijawAudio.translator.grammar.service;

import com.ijawAudio.translator.grammar.model.ParsedSlots;
import com.ijawAudio.translator.grammar.model.QuestionType;
import com.ijawAudio.translator.lexicon.ClosedWordClasses;
import com.ijawAudio.translator.lexicon.model.WordRole;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sentence tagger - shallow, single left-to-right pass that fills the sentence slots.
 *
 * Rules per token, first match wins and a filled slot is never overwritten:
 * - pronoun (not possessive) fills subject
 * - verb fills verb
 * - noun fills object, or location for place nouns once object is taken
 * - adjective fills adjective
 * - temporal word fills time
 *
 * The question type comes from the sentence prefix, not from the tokens.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SentenceTagger {

    private final WordClassifier wordClassifier;

    /**
     * Tags a sentence. Deterministic and side-effect free.
     *
     * @param sentence English sentence (may be null or empty)
     * @return Filled slots
     */
    public ParsedSlots parse(String sentence) {
        String subject = null;
        String object = null;
        String verb = null;
        String adjective = null;
        String location = null;
        String time = null;

        for (String rawToken : TextNormalizer.tokenize(TextNormalizer.normalize(sentence))) {
            String token = TextNormalizer.stripEdgePunctuation(rawToken);
            if (token.isEmpty()) {
                continue;
            }
            WordRole role = wordClassifier.classify(token);

            if (role == WordRole.PRONOUN && subject == null
                    && !ClosedWordClasses.POSSESSIVE_PRONOUNS.contains(token)) {
                subject = token;
            } else if (role == WordRole.VERB && verb == null) {
                verb = token;
            } else if (role == WordRole.NOUN) {
                if (object == null) {
                    object = token;
                } else if (location == null && ClosedWordClasses.PLACE_NOUNS.contains(token)) {
                    location = token;
                }
            } else if (role == WordRole.ADJECTIVE && adjective == null) {
                adjective = token;
            } else if (time == null && ClosedWordClasses.TIME_WORDS.contains(token)) {
                time = token;
            }
        }

        ParsedSlots slots = ParsedSlots.builder()
                .subject(subject)
                .object(object)
                .verb(verb)
                .adjective(adjective)
                .location(location)
                .time(time)
                .questionType(QuestionType.detect(sentence).orElse(null))
                .build();
        log.debug("Tagged sentence - slots: {}", slots);
        return slots;
    }
}
