package com.ijawAudio.translator.grammar.service;

import com.ijawAudio.translator.grammar.rule.GenerationContext;
import com.ijawAudio.translator.grammar.rule.GenerationRule;
import com.ijawAudio.translator.grammar.rule.PossessivePhraseRule;
import com.ijawAudio.translator.grammar.rule.QuestionRule;
import com.ijawAudio.translator.grammar.rule.SubjectAdjectiveRule;
import com.ijawAudio.translator.grammar.rule.SubjectObjectVerbRule;
import com.ijawAudio.translator.grammar.rule.SubjectVerbRule;
import com.ijawAudio.translator.grammar.rule.TokenFallbackRule;
import com.ijawAudio.translator.grammar.rule.VerbatimPhraseRule;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.WordClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Translation generator - renders Ijaw text through a priority-ordered cascade of templates.
 *
 * Cascade (first match wins):
 * 1. verbatim phrase dictionary hit
 * 2. question templates
 * 3. subject + adjective
 * 4. subject + object + verb
 * 5. subject + verb
 * 6. possessive phrase
 * 7. token-by-token translation
 *
 * The last rule always matches, so generation is total.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationGenerator {

    private final Lexicon lexicon;
    private final WordClassifier wordClassifier;
    private final SentenceTagger sentenceTagger;
    private final List<GenerationRule> rules = List.of(
            new VerbatimPhraseRule(),
            new QuestionRule(),
            new SubjectAdjectiveRule(),
            new SubjectObjectVerbRule(),
            new SubjectVerbRule(),
            new PossessivePhraseRule(),
            new TokenFallbackRule()
    );

    /**
     * Generates the Ijaw rendering of an English sentence. Never throws.
     *
     * @param sentence English sentence (null is treated as empty)
     * @return Ijaw text, empty for empty input
     */
    public String generate(String sentence) {
        GenerationContext context = new GenerationContext(
                sentence, lexicon.snapshot(), wordClassifier, sentenceTagger::parse);

        for (GenerationRule rule : rules) {
            Optional<String> rendered = applySafely(rule, context);
            if (rendered.isPresent()) {
                log.debug("Generation rule matched - rule: {}, input length: {}", rule.name(), context.sentence().length());
                return rendered.get();
            }
        }
        // unreachable while the token fallback closes the cascade
        return context.sentence();
    }

    public List<GenerationRule> rules() {
        return rules;
    }

    private Optional<String> applySafely(GenerationRule rule, GenerationContext context) {
        try {
            return rule.apply(context);
        } catch (RuntimeException e) {
            log.warn("Generation rule failed, trying next rule - rule: {}, error: {}", rule.name(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
