package com.raava.concierge.extraction.detector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes, models and colours recognised in free text.
 * Lookups are case-insensitive and return the canonical spelling.
 */
public class VehicleLexicon {

    private static final Map<String, String> MAKE_ALIASES = new LinkedHashMap<>();
    private static final Map<String, String> MODEL_ALIASES = new LinkedHashMap<>();
    private static final Map<String, String> COLOR_ALIASES = new LinkedHashMap<>();

    static {
        // Multi-word aliases first so "aston martin" wins over "aston".
        MAKE_ALIASES.put("aston martin", "Aston Martin");
        MAKE_ALIASES.put("rolls royce", "Rolls Royce");
        MAKE_ALIASES.put("rolls-royce", "Rolls Royce");
        MAKE_ALIASES.put("range rover", "Range Rover");
        MAKE_ALIASES.put("mercedes-benz", "Mercedes");
        MAKE_ALIASES.put("lamborghini", "Lamborghini");
        MAKE_ALIASES.put("lambo", "Lamborghini");
        MAKE_ALIASES.put("ferrari", "Ferrari");
        MAKE_ALIASES.put("porsche", "Porsche");
        MAKE_ALIASES.put("mclaren", "McLaren");
        MAKE_ALIASES.put("aston", "Aston Martin");
        MAKE_ALIASES.put("bentley", "Bentley");
        MAKE_ALIASES.put("rolls", "Rolls Royce");
        MAKE_ALIASES.put("mercedes", "Mercedes");
        MAKE_ALIASES.put("merc", "Mercedes");
        MAKE_ALIASES.put("bmw", "BMW");
        MAKE_ALIASES.put("audi", "Audi");
        MAKE_ALIASES.put("jaguar", "Jaguar");
        MAKE_ALIASES.put("maserati", "Maserati");
        MAKE_ALIASES.put("bugatti", "Bugatti");
        MAKE_ALIASES.put("vauxhall", "Vauxhall");

        MODEL_ALIASES.put("huracan evo", "Huracan EVO");
        MODEL_ALIASES.put("aventador svj", "Aventador SVJ");
        MODEL_ALIASES.put("f8 tributo", "F8 Tributo");
        MODEL_ALIASES.put("sf90 stradale", "SF90 Stradale");
        MODEL_ALIASES.put("911 turbo s", "911 Turbo S");
        MODEL_ALIASES.put("continental gt", "Continental GT");
        MODEL_ALIASES.put("flying spur", "Flying Spur");
        MODEL_ALIASES.put("g63", "G63 AMG");
        MODEL_ALIASES.put("urus", "Urus");
        MODEL_ALIASES.put("huracan", "Huracan");
        MODEL_ALIASES.put("aventador", "Aventador");
        MODEL_ALIASES.put("revuelto", "Revuelto");
        MODEL_ALIASES.put("roma", "Roma");
        MODEL_ALIASES.put("f8", "F8 Tributo");
        MODEL_ALIASES.put("sf90", "SF90 Stradale");
        MODEL_ALIASES.put("purosangue", "Purosangue");
        MODEL_ALIASES.put("911", "911");
        MODEL_ALIASES.put("cayenne", "Cayenne");
        MODEL_ALIASES.put("taycan", "Taycan");
        MODEL_ALIASES.put("panamera", "Panamera");
        MODEL_ALIASES.put("macan", "Macan");
        MODEL_ALIASES.put("720s", "720S");
        MODEL_ALIASES.put("750s", "750S");
        MODEL_ALIASES.put("artura", "Artura");
        MODEL_ALIASES.put("db11", "DB11");
        MODEL_ALIASES.put("db12", "DB12");
        MODEL_ALIASES.put("dbs", "DBS Superleggera");
        MODEL_ALIASES.put("dbx", "DBX707");
        MODEL_ALIASES.put("vantage", "Vantage");
        MODEL_ALIASES.put("bentayga", "Bentayga");
        MODEL_ALIASES.put("cullinan", "Cullinan");
        MODEL_ALIASES.put("ghost", "Ghost");
        MODEL_ALIASES.put("phantom", "Phantom");
        MODEL_ALIASES.put("wraith", "Wraith");
        MODEL_ALIASES.put("m8", "M8 Competition");
        MODEL_ALIASES.put("r8", "R8");
        MODEL_ALIASES.put("f-type", "F-Type");
        MODEL_ALIASES.put("mc20", "MC20");
        MODEL_ALIASES.put("chiron", "Chiron");

        COLOR_ALIASES.put("rosso corsa", "Rosso Corsa");
        COLOR_ALIASES.put("british racing green", "British Racing Green");
        COLOR_ALIASES.put("black", "Black");
        COLOR_ALIASES.put("nero", "Black");
        COLOR_ALIASES.put("white", "White");
        COLOR_ALIASES.put("bianco", "White");
        COLOR_ALIASES.put("red", "Red");
        COLOR_ALIASES.put("rosso", "Red");
        COLOR_ALIASES.put("blue", "Blue");
        COLOR_ALIASES.put("blu", "Blue");
        COLOR_ALIASES.put("green", "Green");
        COLOR_ALIASES.put("verde", "Green");
        COLOR_ALIASES.put("yellow", "Yellow");
        COLOR_ALIASES.put("giallo", "Yellow");
        COLOR_ALIASES.put("orange", "Orange");
        COLOR_ALIASES.put("silver", "Silver");
        COLOR_ALIASES.put("grey", "Grey");
        COLOR_ALIASES.put("gray", "Grey");
        COLOR_ALIASES.put("grigio", "Grey");
        COLOR_ALIASES.put("purple", "Purple");
        COLOR_ALIASES.put("brown", "Brown");
        COLOR_ALIASES.put("gold", "Gold");
        COLOR_ALIASES.put("bronze", "Bronze");
        COLOR_ALIASES.put("beige", "Beige");
    }

    private static final Pattern MAKE_PATTERN = alternation(MAKE_ALIASES);
    private static final Pattern MODEL_PATTERN = alternation(MODEL_ALIASES);
    private static final Pattern COLOR_PATTERN = alternation(COLOR_ALIASES);

    private VehicleLexicon() {}

    public static Optional<String> findMake(String text) {
        return find(MAKE_PATTERN, MAKE_ALIASES, text);
    }

    public static Optional<String> findModel(String text) {
        return find(MODEL_PATTERN, MODEL_ALIASES, text);
    }

    public static Optional<String> findColor(String text) {
        return find(COLOR_PATTERN, COLOR_ALIASES, text);
    }

    /**
     * Canonical make names, for prompts.
     */
    public static List<String> featuredMakes() {
        return List.of("Lamborghini", "Ferrari", "Porsche", "McLaren", "Aston Martin", "Bentley", "Rolls Royce");
    }

    private static Optional<String> find(Pattern pattern, Map<String, String> aliases, String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.ofNullable(aliases.get(matcher.group(1).toLowerCase(Locale.ROOT)));
        }
        return Optional.empty();
    }

    private static Pattern alternation(Map<String, String> aliases) {
        StringBuilder regex = new StringBuilder("(?<![\\w-])(");
        boolean first = true;
        for (String alias : aliases.keySet()) {
            if (!first) {
                regex.append('|');
            }
            regex.append(Pattern.quote(alias));
            first = false;
        }
        regex.append(")(?![\\w-])");
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
