package com.shoptalk.assistant.taxonomy;

import com.shoptalk.assistant.text.TextMatching;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static store taxonomy: main categories, their subcategories and the words shoppers use for them.
 *
 * Matching is whole-word and case-insensitive. When several names or aliases match,
 * the longest phrase wins; equal lengths go to the one declared first.
 */
@Slf4j
@Component
public class CategoryTaxonomy {

    public static final String SPORTS_FITNESS = "Sports & Fitness";
    public static final String ELECTRIC_SCOOTERS = "Electric Scooters";
    public static final String OFFICE_FURNITURE = "Office Furniture";
    public static final String HOSPITALITY_FURNITURE = "Hospitality Furniture";
    public static final String HOME_FURNITURE = "Home Furniture";
    public static final String PET_PRODUCTS = "Pet Products";

    private static final Map<String, List<String>> SUBCATEGORIES = new LinkedHashMap<>();
    private static final Map<String, List<String>> CATEGORY_ALIASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> SUBCATEGORY_ALIASES = new LinkedHashMap<>();

    static {
        SUBCATEGORIES.put(SPORTS_FITNESS, List.of(
                "Fitness Accessories", "Treadmills", "Exercise Bikes", "Rowing Machines", "Dumbbells",
                "Kettlebells", "Gym Bench", "Yoga Mats", "Trampolines", "Boxing & Muay Thai",
                "Focus Pads", "Martial Arts", "Weightlifting", "MMA"));
        SUBCATEGORIES.put(ELECTRIC_SCOOTERS, List.of(
                "Electric Scooters", "Scooter Accessories"));
        SUBCATEGORIES.put(OFFICE_FURNITURE, List.of(
                "Desks", "Corner Desks", "Sit Stand Desks", "Study Desks", "Workstations",
                "Chairs", "Gaming Chairs", "Ergonomic Chairs", "Mesh Office Chairs", "Visitor Chairs",
                "Filing Cabinets", "Office Shelving", "Monitor Arms", "Whiteboards", "Lockers"));
        SUBCATEGORIES.put(HOSPITALITY_FURNITURE, List.of(
                "Bar Stools", "Bar Tables", "Cafe Chairs", "Cafe Tables", "Reception Seating",
                "Outdoor Furniture"));
        SUBCATEGORIES.put(HOME_FURNITURE, List.of(
                "Tables", "Coffee Tables", "Dining Tables", "Sofas", "Beds", "Mattresses", "Ottomans",
                "Bookcases", "Bedside Tables", "Living Room Furniture", "Dining Room Furniture",
                "Kids Room Furniture", "Lighting"));
        SUBCATEGORIES.put(PET_PRODUCTS, List.of(
                "Dog Supplies", "Dog Kennels", "Dog Toys", "Cat Supplies", "Cat Trees", "Cat Toys",
                "Bird Cages & Stands", "Bird Supplies", "Pet Feeders", "Pet Carriers", "Rabbit Cages",
                "Aquariums"));

        CATEGORY_ALIASES.put(SPORTS_FITNESS, List.of("sports", "fitness", "gym", "exercise", "workout", "training"));
        CATEGORY_ALIASES.put(ELECTRIC_SCOOTERS, List.of("scooter", "escooter", "e-scooter", "electric scooter"));
        CATEGORY_ALIASES.put(OFFICE_FURNITURE, List.of("office", "workspace", "work furniture"));
        CATEGORY_ALIASES.put(HOSPITALITY_FURNITURE, List.of("hospitality", "hotel", "restaurant", "cafe", "commercial"));
        CATEGORY_ALIASES.put(HOME_FURNITURE, List.of("home", "house", "residential", "living", "bedroom"));
        CATEGORY_ALIASES.put(PET_PRODUCTS, List.of("pet", "dog", "cat", "bird", "animal", "pet supplies"));

        SUBCATEGORY_ALIASES.put("Dumbbells", List.of("dumbbell", "free weights", "hand weights"));
        SUBCATEGORY_ALIASES.put("Treadmills", List.of("treadmill", "running machine"));
        SUBCATEGORY_ALIASES.put("Exercise Bikes", List.of("exercise bike", "spin bike", "stationary bike"));
        SUBCATEGORY_ALIASES.put("Rowing Machines", List.of("rowing machine", "rower"));
        SUBCATEGORY_ALIASES.put("Gym Bench", List.of("weight bench", "workout bench"));
        SUBCATEGORY_ALIASES.put("Boxing & Muay Thai", List.of("boxing", "muay thai", "punching bag", "boxing gloves"));
        SUBCATEGORY_ALIASES.put("Gaming Chairs", List.of("gaming chair", "gamer chair", "esports chair"));
        SUBCATEGORY_ALIASES.put("Sit Stand Desks", List.of("standing desk", "height adjustable desk", "sit-stand desk"));
        SUBCATEGORY_ALIASES.put("Ergonomic Chairs", List.of("ergonomic chair", "office chair"));
        SUBCATEGORY_ALIASES.put("Chairs", List.of("chair", "seat", "seating"));
        SUBCATEGORY_ALIASES.put("Desks", List.of("desk", "computer desk"));
        SUBCATEGORY_ALIASES.put("Tables", List.of("table"));
        SUBCATEGORY_ALIASES.put("Sofas", List.of("sofa", "couch", "lounge"));
        SUBCATEGORY_ALIASES.put("Beds", List.of("bed", "bed frame"));
        SUBCATEGORY_ALIASES.put("Bookcases", List.of("bookcase", "bookshelf"));
        SUBCATEGORY_ALIASES.put("Filing Cabinets", List.of("filing cabinet", "cabinet"));
        SUBCATEGORY_ALIASES.put("Dog Kennels", List.of("kennel", "dog house", "dog crate"));
        SUBCATEGORY_ALIASES.put("Cat Trees", List.of("cat tree", "cat tower", "scratching post"));
        SUBCATEGORY_ALIASES.put("Bird Cages & Stands", List.of("bird cage", "aviary", "parrot cage"));
        SUBCATEGORY_ALIASES.put("Electric Scooters", List.of("e-scooter", "electric scooter"));
    }

    /**
     * Main category named or implied by the text. Subcategory phrases count for their parent.
     */
    public Optional<String> matchCategory(String text) {
        Map<String, String> phrases = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : SUBCATEGORIES.entrySet()) {
            phrases.putIfAbsent(entry.getKey(), entry.getKey());
            for (String alias : CATEGORY_ALIASES.getOrDefault(entry.getKey(), List.of())) {
                phrases.putIfAbsent(alias, entry.getKey());
            }
        }
        for (Map.Entry<String, String> entry : subcategoryPhrases().entrySet()) {
            parentOf(entry.getValue()).ifPresent(parent -> phrases.putIfAbsent(entry.getKey(), parent));
        }
        Optional<String> matched = TextMatching.longestPhrase(text, phrases.keySet()).map(phrases::get);
        log.debug("Category match: text='{}', category={}", text, matched.orElse(null));
        return matched;
    }

    public Optional<String> matchSubcategory(String text) {
        Map<String, String> phrases = subcategoryPhrases();
        return TextMatching.longestPhrase(text, phrases.keySet()).map(phrases::get);
    }

    /**
     * Main category owning a subcategory. A name listed under several categories belongs to the first.
     */
    public Optional<String> parentOf(String subcategory) {
        if (subcategory == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> entry : SUBCATEGORIES.entrySet()) {
            for (String candidate : entry.getValue()) {
                if (candidate.equalsIgnoreCase(subcategory)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public List<String> subcategoriesOf(String category) {
        return SUBCATEGORIES.getOrDefault(category, List.of());
    }

    public List<String> categories() {
        return Collections.unmodifiableList(new ArrayList<>(SUBCATEGORIES.keySet()));
    }

    // ==================== Helper Methods ====================

    /**
     * Subcategory names and aliases, lowercased, mapped to the subcategory, in declaration order.
     */
    private Map<String, String> subcategoryPhrases() {
        Map<String, String> phrases = new LinkedHashMap<>();
        for (List<String> subcategories : SUBCATEGORIES.values()) {
            for (String subcategory : subcategories) {
                phrases.putIfAbsent(subcategory.toLowerCase(), subcategory);
            }
        }
        for (Map.Entry<String, List<String>> entry : SUBCATEGORY_ALIASES.entrySet()) {
            for (String alias : entry.getValue()) {
                phrases.putIfAbsent(alias, entry.getKey());
            }
        }
        return phrases;
    }
}
