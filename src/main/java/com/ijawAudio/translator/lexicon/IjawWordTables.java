package com.ijawAudio.translator.lexicon;

import com.ijawAudio.translator.lexicon.model.RoleTable;
import com.ijawAudio.translator.lexicon.model.WordRole;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Compiled-in role tables of the Ijaw (Izon) lexicon.
 *
 * These tables are not loaded from the dictionary asset. Each English form appears in at most one
 * table, and {@link #ROLE_TABLES} fixes the classification precedence:
 * pronoun, verb, noun, adjective.
 */
public final class IjawWordTables {

    public static final RoleTable PRONOUNS = new RoleTable(WordRole.PRONOUN, Map.ofEntries(
            entry("i", "Arí"),
            entry("you", "Ị"),
            entry("he", "U"),
            entry("she", "A"),
            entry("we", "Wónì"),
            entry("they", "Wónì"),
            entry("my", "yè"),
            entry("your", "wè"),
            entry("his", "yè"),
            entry("her", "yè"),
            entry("our", "wónì"),
            entry("their", "wónì")
    ));

    public static final RoleTable VERBS = new RoleTable(WordRole.VERB, Map.ofEntries(
            entry("am", "ye"),
            entry("is", "ye"),
            entry("are", "ye"),
            entry("have", "sabi"),
            entry("has", "sabi"),
            entry("want", "wọnt"),
            entry("wants", "wọnt"),
            entry("like", "laik"),
            entry("likes", "laik"),
            entry("see", "fịnị"),
            entry("sees", "fịnị"),
            entry("eat", "fị"),
            entry("eats", "fị"),
            entry("drink", "mu"),
            entry("drinks", "mu"),
            entry("go", "gha"),
            entry("goes", "gha"),
            entry("come", "bia"),
            entry("comes", "bia"),
            entry("work", "wok"),
            entry("works", "wok"),
            entry("sleep", "turu"),
            entry("sleeps", "turu"),
            entry("build", "bil"),
            entry("builds", "bil"),
            entry("take", "akị́"),
            entry("takes", "akị́"),
            entry("give", "giv"),
            entry("gives", "giv"),
            entry("help", "help"),
            entry("helps", "help"),
            entry("walk", "waka"),
            entry("walks", "waka"),
            entry("run", "ron"),
            entry("runs", "ron"),
            entry("dance", "dans"),
            entry("dances", "dans"),
            entry("sing", "son"),
            entry("sings", "son"),
            entry("cook", "nkọ̀rọ"),
            entry("cooks", "nkọ̀rọ")
    ));

    public static final RoleTable NOUNS = new RoleTable(WordRole.NOUN, Map.ofEntries(
            entry("house", "wárị"),
            entry("water", "bení"),
            entry("food", "fị́yaị"),
            entry("fish", "ìndí"),
            entry("river", "ọ́wụ"),
            entry("sun", "sọ́"),
            entry("moon", "akalụ́"),
            entry("child", "tọ́bọ̀ụ"),
            entry("friend", "kẹ́nị"),
            entry("family", "wárịbịbị̀"),
            entry("father", "owéi"),
            entry("mother", "ẹ́rẹ"),
            entry("brother", "bàrà"),
            entry("sister", "eréwèrí"),
            entry("money", "abadị-ugú"),
            entry("yam", "òkù-ị̀wẹ"),
            entry("cassava", "abábùrú"),
            entry("canoe", "òrù"),
            entry("cup", "agbéì"),
            entry("net", "agbunú"),
            entry("market", "maket"),
            entry("village", "òkù-ámà"),
            entry("farm", "ògbó"),
            entry("fire", "faya"),
            entry("ancestor", "ìwéi"),
            entry("ancestors", "ìwéi-wónì"),
            entry("children", "tọ́bọ̀ụ-wónì"),
            entry("friends", "kẹ́nị-wónì"),
            entry("people", "òkù-wónì")
    ));

    public static final RoleTable ADJECTIVES = new RoleTable(WordRole.ADJECTIVE, Map.ofEntries(
            entry("good", "botu"),
            entry("bad", "kiri"),
            entry("big", "toru"),
            entry("small", "kiri-kiri"),
            entry("happy", "hapi"),
            entry("tired", "sik"),
            entry("strong", "strong"),
            entry("wise", "akíròro"),
            entry("kind", "botu"),
            entry("busy", "wok haad"),
            entry("hungry", "hongri"),
            entry("thirsty", "tosti"),
            entry("hot", "tuu dọ́n"),
            entry("cold", "kol"),
            entry("clean", "klin"),
            entry("fresh", "nyu"),
            entry("warm", "hot"),
            entry("bright", "rait"),
            entry("deep", "tọ́n"),
            entry("long", "pórù"),
            entry("tall", "toru"),
            entry("beautiful", "fain"),
            entry("angry", "kírimá"),
            entry("sad", "kiri"),
            entry("old", "òkú"),
            entry("young", "tọ́bọ̀ụ"),
            entry("new", "nyu"),
            entry("fast", "fast"),
            entry("slow", "slow"),
            entry("sick", "sik")
    ));

    /**
     * Role tables in classification and lookup precedence order.
     */
    public static final List<RoleTable> ROLE_TABLES = List.of(PRONOUNS, VERBS, NOUNS, ADJECTIVES);

    private IjawWordTables() {}
}
