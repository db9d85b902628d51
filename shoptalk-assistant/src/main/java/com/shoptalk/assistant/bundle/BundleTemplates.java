package com.shoptalk.assistant.bundle;

import com.shoptalk.assistant.text.TextMatching;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named starter kits. A template applies when one of its trigger words appears next to
 * a bundle word such as "starter", "kit" or "setup".
 */
public final class BundleTemplates {

    private BundleTemplates() {}

    public static final List<String> BUNDLE_WORDS = List.of(
            "starter", "starter kit", "kit", "bundle", "setup", "set up", "essentials", "everything i need");

    /**
     * A starter kit and the words that select it.
     */
    public record Template(String name, List<String> triggers, List<ItemTemplate> items) {}

    private static final Map<String, Template> TEMPLATES = new LinkedHashMap<>();

    static {
        register(new Template("bird", List.of("bird", "parrot", "budgie", "cockatiel"), List.of(
                item("bird_cage", 1, true, List.of("bird cage", "aviary", "parrot cage"), List.of("Bird Cages & Stands")),
                item("perch", 1, false, List.of("bird perch", "perch"), List.of("Bird Supplies", "Bird Cages & Stands")),
                item("bird_toy", 2, false, List.of("bird toy", "parrot toy"), List.of("Bird Supplies")),
                item("feeder", 1, false, List.of("bird feeder", "seed feeder"), List.of("Bird Supplies", "Pet Feeder")))));

        register(new Template("puppy", List.of("puppy", "dog"), List.of(
                item("dog_bed", 1, true, List.of("dog bed", "pet bed"), List.of("Dog Supplies")),
                item("food_bowl", 1, true, List.of("dog bowl", "food bowl"), List.of("Pet Feeder", "Dog Supplies")),
                item("leash", 1, false, List.of("dog leash", "lead"), List.of("Dog Supplies")),
                item("dog_toy", 2, false, List.of("dog toy", "chew toy"), List.of("Dog Supplies")),
                item("pet_carrier", 1, false, List.of("pet carrier", "dog crate"), List.of("Pet Carrier")))));

        register(new Template("kitten", List.of("kitten", "cat"), List.of(
                item("scratching_post", 1, true, List.of("scratching post", "cat tree"), List.of("Cat Supplies")),
                item("litter_box", 1, true, List.of("litter box", "litter tray"), List.of("Cat Supplies")),
                item("food_bowl", 1, false, List.of("cat bowl", "pet feeder"), List.of("Pet Feeder", "Cat Supplies")),
                item("cat_toy", 2, false, List.of("cat toy"), List.of("Cat Supplies")),
                item("water_fountain", 1, false, List.of("pet fountain", "water fountain"), List.of("Pet Fountain")))));

        register(new Template("home_office", List.of("home office", "office", "work from home", "wfh"), List.of(
                item("desk", 1, true, List.of("office desk", "desk"), List.of("Desks", "Workstation")),
                item("chair", 1, true, List.of("office chair", "ergonomic chair", "chair"), List.of("Chairs")),
                item("monitor_arm", 1, false, List.of("monitor arm"), List.of("Monitor Arm")),
                item("desk_lamp", 1, false, List.of("desk lamp", "lamp"), List.of("Lighting")),
                item("filing_cabinet", 1, false, List.of("filing cabinet"), List.of("Filing Cabinets")))));

        register(new Template("home_gym", List.of("home gym", "gym", "workout", "fitness"), List.of(
                item("dumbbells", 1, true, List.of("dumbbell set", "dumbbell"), List.of("Dumbbells", "Weightlifting")),
                item("gym_bench", 1, true, List.of("gym bench", "weight bench"), List.of("Gym Bench")),
                item("exercise_mat", 1, false, List.of("exercise mat", "yoga mat"), List.of("Flooring & Mats", "Yoga Mat")),
                item("kettlebell", 1, false, List.of("kettlebell"), List.of("Kettlebells")))));
    }

    /**
     * Template selected by the text, or empty when no trigger appears next to a bundle word.
     */
    public static Optional<Template> match(String text) {
        boolean bundleWord = BUNDLE_WORDS.stream().anyMatch(word -> TextMatching.containsPhrase(text, word));
        if (!bundleWord) {
            return Optional.empty();
        }
        for (Template template : TEMPLATES.values()) {
            if (template.triggers().stream().anyMatch(trigger -> TextMatching.containsPhrase(text, trigger))) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    public static Optional<Template> byName(String name) {
        return Optional.ofNullable(TEMPLATES.get(name));
    }

    private static void register(Template template) {
        TEMPLATES.put(template.name(), template);
    }

    private static ItemTemplate item(String type, int quantity, boolean required, List<String> terms,
                                     List<String> categories) {
        return ItemTemplate.builder()
                .itemType(type)
                .quantity(quantity)
                .required(required)
                .searchTerms(terms)
                .categories(categories)
                .build();
    }
}
