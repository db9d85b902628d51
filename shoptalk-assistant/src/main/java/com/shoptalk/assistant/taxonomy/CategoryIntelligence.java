package com.shoptalk.assistant.taxonomy;

import com.shoptalk.assistant.text.TextMatching;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps shopper context, item words and everyday phrases onto the category names that
 * products actually carry in the catalog.
 */
@Slf4j
@Component
public class CategoryIntelligence {

    /**
     * A context group detected in free text and the catalog categories it covers.
     */
    public record ContextMatch(String context, List<String> categories, int score) {}

    /**
     * A known everyday phrase and the categories and search terms it stands for.
     */
    public record PhraseTranslation(String phrase, List<String> categories, List<String> searchTerms) {

        public String searchQuery() {
            return String.join(" ", searchTerms);
        }
    }

    private static final Map<String, List<String>> CATEGORY_GROUPS = new LinkedHashMap<>();
    private static final Map<String, List<String>> CONTEXT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> ITEM_CATEGORY_MAP = new LinkedHashMap<>();
    private static final Map<String, PhraseTranslation> PHRASES = new LinkedHashMap<>();

    static {
        CATEGORY_GROUPS.put("pet", List.of(
                "Dog Supplies", "Cat Supplies", "Pets", "Pet Carrier", "Pet Feeder", "Pet Fountain",
                "Pet Care Coops & Hutches", "Bird Cages & Stands", "Bird Supplies", "Aquarium", "Rabbit Cage"));
        CATEGORY_GROUPS.put("fitness", List.of(
                "Fitness", "Fitness Accessories", "Functional Fitness", "Weightlifting", "Dumbbells",
                "Kettlebells", "Gym Bench", "Exercise Bikes", "Treadmills", "Rowing Machine",
                "Boxing & Muay Thai", "Gloves", "Focus Pads", "Flooring & Mats", "Yoga Mat"));
        CATEGORY_GROUPS.put("office", List.of(
                "Desks", "Desks Frame", "Chairs", "Filing Cabinets", "Office Cupboards", "Office Shelving",
                "Workstation", "Monitor Arm", "Pedestals", "Whiteboards", "Screens", "Lighting"));
        CATEGORY_GROUPS.put("furniture", List.of(
                "Bed", "Mattresses", "Sofa", "Lounge", "Recliners", "Ottoman", "Living Room Furniture",
                "Dining Room Furniture", "Kids Furniture", "Bookcase", "Shelves", "Storage", "Tables",
                "Table & Chair Set", "Bar Stool", "Bench", "Lighting"));
        CATEGORY_GROUPS.put("outdoor", List.of(
                "Outdoor Furniture", "Home & Garden", "Vertical Garden", "Bikes", "Electric Scooters",
                "Electric Scooters Accessories"));
        CATEGORY_GROUPS.put("electronics", List.of(
                "CCTV Camera", "Speakers", "TV Accessories", "Projectors & Accessories", "Power Point"));

        CONTEXT_KEYWORDS.put("pet", List.of(
                "pet", "puppy", "dog", "cat", "kitten", "bird", "parrot", "budgie", "fish", "aquarium",
                "rabbit", "bunny", "hamster", "new pet", "fur baby", "adopted"));
        CONTEXT_KEYWORDS.put("fitness", List.of(
                "gym", "workout", "exercise", "fitness", "training", "muscle", "strength", "cardio",
                "lifting", "boxing", "mma", "martial arts", "yoga", "pilates", "home gym", "get fit"));
        CONTEXT_KEYWORDS.put("office", List.of(
                "office", "work", "desk", "computer", "laptop", "work from home", "wfh", "remote work",
                "home office", "study", "workstation", "ergonomic", "back pain", "posture", "monitor"));
        CONTEXT_KEYWORDS.put("furniture", List.of(
                "furniture", "room", "bedroom", "living room", "dining", "home", "house", "apartment",
                "decor", "cozy", "sleep", "lounge", "storage", "kids", "nursery"));
        CONTEXT_KEYWORDS.put("outdoor", List.of(
                "outdoor", "outside", "garden", "patio", "backyard", "balcony", "terrace", "commute",
                "ride", "cycling", "scooter"));
        CONTEXT_KEYWORDS.put("electronics", List.of(
                "camera", "security", "tv", "television", "speaker", "projector", "audio", "power"));

        ITEM_CATEGORY_MAP.put("bird cage", List.of("Bird Cages & Stands"));
        ITEM_CATEGORY_MAP.put("cage", List.of("Bird Cages & Stands", "Rabbit Cage"));
        ITEM_CATEGORY_MAP.put("perch", List.of("Bird Supplies", "Bird Cages & Stands"));
        ITEM_CATEGORY_MAP.put("bird toy", List.of("Bird Supplies"));
        ITEM_CATEGORY_MAP.put("collar", List.of("Dog Supplies", "Cat Supplies"));
        ITEM_CATEGORY_MAP.put("leash", List.of("Dog Supplies"));
        ITEM_CATEGORY_MAP.put("dog bed", List.of("Dog Supplies"));
        ITEM_CATEGORY_MAP.put("cat bed", List.of("Cat Supplies"));
        ITEM_CATEGORY_MAP.put("food bowl", List.of("Pet Feeder", "Dog Supplies", "Cat Supplies"));
        ITEM_CATEGORY_MAP.put("feeder", List.of("Pet Feeder", "Bird Supplies"));
        ITEM_CATEGORY_MAP.put("water fountain", List.of("Pet Fountain"));
        ITEM_CATEGORY_MAP.put("pet carrier", List.of("Pet Carrier"));
        ITEM_CATEGORY_MAP.put("crate", List.of("Pet Carrier", "Dog Supplies"));
        ITEM_CATEGORY_MAP.put("scratching post", List.of("Cat Supplies"));
        ITEM_CATEGORY_MAP.put("litter", List.of("Cat Supplies"));
        ITEM_CATEGORY_MAP.put("dog toy", List.of("Dog Supplies"));
        ITEM_CATEGORY_MAP.put("cat toy", List.of("Cat Supplies"));
        ITEM_CATEGORY_MAP.put("dumbbell", List.of("Dumbbells", "Weightlifting"));
        ITEM_CATEGORY_MAP.put("kettlebell", List.of("Kettlebells"));
        ITEM_CATEGORY_MAP.put("bench", List.of("Gym Bench", "Bench"));
        ITEM_CATEGORY_MAP.put("treadmill", List.of("Treadmills"));
        ITEM_CATEGORY_MAP.put("exercise bike", List.of("Exercise Bikes"));
        ITEM_CATEGORY_MAP.put("yoga mat", List.of("Yoga Mat", "Flooring & Mats"));
        ITEM_CATEGORY_MAP.put("mat", List.of("Flooring & Mats", "Yoga Mat"));
        ITEM_CATEGORY_MAP.put("desk", List.of("Desks", "Workstation"));
        ITEM_CATEGORY_MAP.put("chair", List.of("Chairs"));
        ITEM_CATEGORY_MAP.put("office chair", List.of("Chairs"));
        ITEM_CATEGORY_MAP.put("lamp", List.of("Lighting"));
        ITEM_CATEGORY_MAP.put("monitor arm", List.of("Monitor Arm"));
        ITEM_CATEGORY_MAP.put("filing cabinet", List.of("Filing Cabinets"));
        ITEM_CATEGORY_MAP.put("cabinet", List.of("Filing Cabinets", "Office Cupboards"));
        ITEM_CATEGORY_MAP.put("shelf", List.of("Office Shelving", "Shelves"));
        ITEM_CATEGORY_MAP.put("bed", List.of("Bed"));
        ITEM_CATEGORY_MAP.put("mattress", List.of("Mattresses"));
        ITEM_CATEGORY_MAP.put("sofa", List.of("Sofa", "Lounge"));
        ITEM_CATEGORY_MAP.put("couch", List.of("Sofa", "Lounge"));
        ITEM_CATEGORY_MAP.put("bookcase", List.of("Bookcase"));
        ITEM_CATEGORY_MAP.put("table", List.of("Tables", "Dining Room Furniture"));
        ITEM_CATEGORY_MAP.put("dining table", List.of("Dining Room Furniture", "Tables"));
        ITEM_CATEGORY_MAP.put("stool", List.of("Bar Stool"));
        ITEM_CATEGORY_MAP.put("scooter", List.of("Electric Scooters"));

        phrase("back pain", List.of("Chairs", "Desks"), List.of("ergonomic", "posture"));
        phrase("back hurts", List.of("Chairs", "Desks"), List.of("ergonomic", "lumbar support"));
        phrase("sitting all day", List.of("Chairs", "Desks"), List.of("ergonomic", "sit stand"));
        phrase("new puppy", List.of("Dog Supplies", "Pet Feeder", "Pet Carrier"), List.of("puppy", "dog"));
        phrase("got a puppy", List.of("Dog Supplies", "Pet Feeder", "Pet Carrier"), List.of("puppy", "dog"));
        phrase("new kitten", List.of("Cat Supplies", "Pet Feeder", "Pet Fountain"), List.of("cat", "kitten"));
        phrase("got a kitten", List.of("Cat Supplies", "Pet Feeder", "Pet Fountain"), List.of("kitten", "cat"));
        phrase("home gym", List.of("Fitness", "Dumbbells", "Gym Bench", "Flooring & Mats"), List.of("gym"));
        phrase("get fit", List.of("Fitness", "Dumbbells", "Exercise Bikes"), List.of("fitness"));
        phrase("work from home", List.of("Desks", "Chairs", "Monitor Arm"), List.of("office", "ergonomic"));
        phrase("study space", List.of("Desks", "Chairs", "Bookcase"), List.of("desk", "study"));
        phrase("living room", List.of("Sofa", "Living Room Furniture", "Ottoman"), List.of("living room"));
        phrase("kids room", List.of("Kids Furniture", "Bed", "Table & Chair Set"), List.of("kids"));
        phrase("small apartment", List.of("Sofa", "Tables", "Shelves", "Storage"), List.of("compact", "space saving"));
    }

    private static void phrase(String phrase, List<String> categories, List<String> searchTerms) {
        PHRASES.put(phrase, new PhraseTranslation(phrase, categories, searchTerms));
    }

    /**
     * Context group with the most keyword hits; ties go to the group declared first.
     */
    public Optional<ContextMatch> detectContext(String text) {
        ContextMatch best = null;
        for (Map.Entry<String, List<String>> entry : CONTEXT_KEYWORDS.entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (TextMatching.containsPhrase(text, keyword)) {
                    score++;
                }
            }
            if (score > 0 && (best == null || score > best.score())) {
                best = new ContextMatch(entry.getKey(), CATEGORY_GROUPS.get(entry.getKey()), score);
            }
        }
        if (best != null) {
            log.debug("Context detected: context={}, score={}", best.context(), best.score());
        }
        return Optional.ofNullable(best);
    }

    public List<String> categoriesOfGroup(String context) {
        return CATEGORY_GROUPS.getOrDefault(context, List.of());
    }

    /**
     * Catalog categories for an item word. Exact entries first, then the longest entry
     * contained in the item, then catalog group names containing the item.
     */
    public List<String> categoriesForItem(String item) {
        String normalized = TextMatching.normalize(item).replace('_', ' ');
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> direct = ITEM_CATEGORY_MAP.get(normalized);
        if (direct != null) {
            return direct;
        }
        Optional<String> contained = TextMatching.longestPhrase(normalized, ITEM_CATEGORY_MAP.keySet());
        if (contained.isPresent()) {
            return ITEM_CATEGORY_MAP.get(contained.get());
        }
        for (List<String> group : CATEGORY_GROUPS.values()) {
            for (String category : group) {
                if (category.toLowerCase(Locale.ROOT).contains(normalized)) {
                    return List.of(category);
                }
            }
        }
        return List.of();
    }

    /**
     * Known everyday phrase in the text; the longest one wins.
     */
    public Optional<PhraseTranslation> translatePhrase(String text) {
        return TextMatching.longestPhrase(text, PHRASES.keySet()).map(PHRASES::get);
    }
}
