package com.ijawAudio.translator.config;

import com.ijawAudio.translator.grammar.model.GrammarInfo;
import com.ijawAudio.translator.grammar.service.GrammarEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the size of the loaded grammar once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrammarEngineStartupListener {

    private final GrammarEngine grammarEngine;

    @EventListener(ApplicationReadyEvent.class)
    public void logGrammarInfo() {
        GrammarInfo info = grammarEngine.grammarInfo();
        log.info("Grammar engine initialized with {} patterns", info.getPatternsCount());
        log.info("Loaded {} pronouns, {} verbs, {} nouns, {} adjectives, {} dictionary entries",
                info.getPronounsCount(), info.getVerbsCount(), info.getNounsCount(),
                info.getAdjectivesCount(), info.getTotalDictionaryEntries());
        log.info("Startup complete - ready for translation");
    }
}
