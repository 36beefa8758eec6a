package com.insider.resolution.rules;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static nickname to formal first-name pairs. Lookups are lowercase.
 */
public final class NicknameTable {

    private static final Map<String, String> NICKNAME_TO_FORMAL = Map.ofEntries(
            Map.entry("bill", "william"), Map.entry("billy", "william"), Map.entry("will", "william"),
            Map.entry("bob", "robert"), Map.entry("bobby", "robert"), Map.entry("rob", "robert"),
            Map.entry("robbie", "robert"),
            Map.entry("dick", "richard"), Map.entry("rick", "richard"), Map.entry("ricky", "richard"),
            Map.entry("rich", "richard"),
            Map.entry("jim", "james"), Map.entry("jimmy", "james"), Map.entry("jamie", "james"),
            Map.entry("mike", "michael"), Map.entry("mickey", "michael"),
            Map.entry("dave", "david"), Map.entry("davey", "david"),
            Map.entry("steve", "steven"), Map.entry("stevie", "steven"),
            Map.entry("chris", "christopher"),
            Map.entry("dan", "daniel"), Map.entry("danny", "daniel"),
            Map.entry("tom", "thomas"), Map.entry("tommy", "thomas"),
            Map.entry("tony", "anthony"),
            Map.entry("joe", "joseph"), Map.entry("joey", "joseph"),
            Map.entry("ben", "benjamin"), Map.entry("benny", "benjamin"),
            Map.entry("sam", "samuel"), Map.entry("sammy", "samuel"),
            Map.entry("matt", "matthew"),
            Map.entry("nick", "nicholas"), Map.entry("nicky", "nicholas"),
            Map.entry("andy", "andrew"), Map.entry("drew", "andrew"),
            Map.entry("greg", "gregory"),
            Map.entry("pat", "patricia"), Map.entry("patty", "patricia"), Map.entry("patti", "patricia"),
            Map.entry("liz", "elizabeth"), Map.entry("beth", "elizabeth"), Map.entry("betty", "elizabeth"),
            Map.entry("betsy", "elizabeth"),
            Map.entry("sue", "susan"), Map.entry("susie", "susan"), Map.entry("suzy", "susan"),
            Map.entry("kathy", "katherine"), Map.entry("kate", "katherine"), Map.entry("katie", "katherine"),
            Map.entry("jen", "jennifer"), Map.entry("jenny", "jennifer"), Map.entry("jenn", "jennifer"),
            Map.entry("ed", "edward"), Map.entry("eddie", "edward"), Map.entry("ted", "edward"),
            Map.entry("larry", "lawrence"), Map.entry("jerry", "gerald"), Map.entry("chuck", "charles"),
            Map.entry("charlie", "charles"), Map.entry("fred", "frederick"), Map.entry("hank", "henry"),
            Map.entry("jack", "john"), Map.entry("johnny", "john"), Map.entry("peggy", "margaret"),
            Map.entry("maggie", "margaret"), Map.entry("ron", "ronald"), Map.entry("don", "donald"),
            Map.entry("ken", "kenneth"), Map.entry("tim", "timothy"), Map.entry("jeff", "jeffrey"),
            Map.entry("doug", "douglas"), Map.entry("al", "albert"), Map.entry("walt", "walter")
    );

    private static final Map<String, Set<String>> FORMAL_TO_NICKNAMES = invert();

    private NicknameTable() {
        // Utility class
    }

    public static Optional<String> formalOf(String name) {
        return Optional.ofNullable(NICKNAME_TO_FORMAL.get(name));
    }

    public static Set<String> nicknamesOf(String formal) {
        return FORMAL_TO_NICKNAMES.getOrDefault(formal, Set.of());
    }

    /**
     * Other first names that may denote the same person, sorted: the formal form of a nickname,
     * or the nicknames of a formal name.
     */
    public static Set<String> alternativesOf(String name) {
        Set<String> alternatives = new TreeSet<>();
        formalOf(name).ifPresent(alternatives::add);
        alternatives.addAll(nicknamesOf(name));
        alternatives.remove(name);
        return alternatives;
    }

    public static boolean areEquivalent(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        String formalA = NICKNAME_TO_FORMAL.getOrDefault(a, a);
        String formalB = NICKNAME_TO_FORMAL.getOrDefault(b, b);
        return formalA.equals(formalB);
    }

    private static Map<String, Set<String>> invert() {
        Map<String, Set<String>> inverted = new HashMap<>();
        NICKNAME_TO_FORMAL.forEach((nick, formal) ->
                inverted.computeIfAbsent(formal, k -> new TreeSet<>()).add(nick));
        Map<String, Set<String>> frozen = new TreeMap<>();
        inverted.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
