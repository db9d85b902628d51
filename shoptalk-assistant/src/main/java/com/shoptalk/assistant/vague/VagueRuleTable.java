package com.shoptalk.assistant.vague;

import com.shoptalk.common.enums.SuggestedTool;
import com.shoptalk.common.enums.VagueCategory;

import java.util.List;

/**
 * Ordered rule table for non-literal shopping requests. Order matters: when two rules
 * score the same, the one listed first wins.
 */
public final class VagueRuleTable {

    private VagueRuleTable() {}

    public static final List<VagueRule> RULES = List.of(

            // ==================== Symptom / Problem ====================

            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(back\\s*(is\\s*)?(killing|hurting|aching|pain|sore|hurts?)|lower\\s*back|bad\\s*posture|posture\\s*(issue|problem)s?|sitting\\s*(all\\s*day|too\\s*(long|much)))\\b")
                    .intent("ergonomic support for back pain")
                    .query("ergonomic office chair lumbar support")
                    .filter("category", "chairs")
                    .build(),
            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(clutter(ed)?|messy|disorganized|stuff\\s*everywhere|too\\s*much\\s*stuff|storage\\s*solutions?)\\b")
                    .intent("storage and organisation")
                    .query("storage cabinet bookshelf organiser")
                    .filter("category", "storage")
                    .build(),
            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(spill(ing|s)?|water\\s*damage|coffee\\s*(ring|stain)s?|stain(s|ed)?)\\b")
                    .intent("water and stain resistant furniture")
                    .query("water resistant stain proof easy clean")
                    .filter("material", "glass")
                    .build(),
            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(neck\\s*(pain|hurts|aching|strain)|looking\\s*down|screen\\s*too\\s*low)\\b")
                    .intent("monitor height or an adjustable desk")
                    .query("monitor arm adjustable height desk")
                    .filter("category", "office")
                    .build(),
            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(can'?t\\s*sleep|insomnia|tossing\\s*(and\\s*)?turning|bad\\s*sleep|sleep\\s*(issues?|problems?))\\b")
                    .intent("a better bed or mattress")
                    .query("comfortable mattress bed frame")
                    .filter("category", "bedroom")
                    .build(),
            VagueRule.builder().category(VagueCategory.SYMPTOM_PROBLEM)
                    .regex("\\b(just\\s*moved|moving\\s*in|new\\s*(apartment|place|home)|first\\s*(apartment|place)|empty\\s*(apartment|room))\\b")
                    .intent("starter furniture for a new place")
                    .query("essential furniture living room bedroom")
                    .build(),

            // ==================== Spatial Constraint ====================

            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b(shoe\\s*box|tiny|cramped|small\\s*(space|apartment|room|studio)|micro\\s*(apartment|studio)|no\\s*room)\\b")
                    .intent("compact furniture for a small space")
                    .query("space saving compact folding")
                    .filter("size", "compact")
                    .build(),
            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b(family\\s*of\\s*\\d+|\\d+\\s*people|big\\s*family|large\\s*family|seats?\\s*\\d+)\\b")
                    .intent("large furniture for a family")
                    .query("large dining table family seating")
                    .filter("category", "tables")
                    .extractNumber(true)
                    .build(),
            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b(awkward\\s*corner|corner\\s*space|empty\\s*corner|that\\s*corner|corner\\s*of\\s*(the\\s*)?(room|office))\\b")
                    .intent("something to fill a corner")
                    .query("corner desk corner shelf l shaped")
                    .filter("descriptor", "corner")
                    .build(),
            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b([4-7]\\s*(ft|foot|')\\s*\\d{1,2}|tall\\s*person|i'?m\\s*(very\\s*)?tall|too\\s*short\\s*for\\s*me)\\b")
                    .intent("larger furniture for a tall person")
                    .query("extra long king size tall")
                    .filter("size", "large")
                    .build(),
            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b(narrow\\s*(door(way)?|hall(way)?|stairs)|won'?t\\s*fit|too\\s*wide)\\b")
                    .intent("furniture that fits through tight access")
                    .query("modular easy assembly compact")
                    .clarification("What are the dimensions of your doorway or space? I can look for pieces that fit.")
                    .build(),
            VagueRule.builder().category(VagueCategory.SPATIAL_CONSTRAINT)
                    .regex("\\b(balcony|patio|backyard|outdoors?|garden|terrace)\\b")
                    .intent("outdoor furniture")
                    .query("outdoor furniture weather resistant")
                    .filter("category", "outdoor")
                    .build(),

            // ==================== Subjective / Slang ====================

            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(boujee|bougie|fancy|luxur(y|ious)|high\\s*end|premium|upscale|classy)\\b")
                    .intent("premium, high quality items")
                    .query("premium luxury high quality")
                    .filter("sort_by", "price_high")
                    .filter("material", "leather")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(broke|student|cheap(est)?|affordable|don'?t\\s*have\\s*much|(limited|tight)\\s*budget|(have\\s*)?no\\s*money|on\\s*a\\s*budget)\\b")
                    .intent("good value on a tight budget")
                    .query("affordable budget value")
                    .filter("sort_by", "price_low")
                    .filter("price_max", 200)
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(industrial|loft|warehouse|exposed\\s*brick)\\b")
                    .intent("an industrial look")
                    .query("industrial metal wood rustic")
                    .filter("style", "industrial")
                    .filter("material", "metal")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(apple\\s*store|minimalist|minimal|clean\\s*lines?|sleek|modern|scandinavian)\\b")
                    .intent("a minimalist, modern look")
                    .query("minimalist modern sleek")
                    .filter("style", "modern")
                    .filter("color", "white")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(cozy|cosy|hygge|snug|homey|comfy)\\b")
                    .intent("cosy, comfortable furniture")
                    .query("cosy comfortable soft plush")
                    .filter("material", "fabric")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(rustic|farmhouse|country|cottage|barn|reclaimed)\\b")
                    .intent("a rustic farmhouse look")
                    .query("rustic farmhouse natural wood")
                    .filter("style", "rustic")
                    .filter("material", "wood")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(mid\\s*century|retro|60s|70s|atomic)\\b")
                    .intent("a mid-century look")
                    .query("mid century retro")
                    .filter("style", "mid-century")
                    .build(),
            VagueRule.builder().category(VagueCategory.SUBJECTIVE_SLANG)
                    .regex("\\b(moody|gothic|dramatic|noir|black\\s*everything)\\b")
                    .intent("a dark aesthetic")
                    .query("dark black matte")
                    .filter("color", "black")
                    .build(),

            // ==================== Lifestyle / Context ====================

            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(stream(ing|er)?|twitch|youtuber|gam(ing|er)|esports|rgb)\\b")
                    .intent("a gaming or streaming setup")
                    .query("gaming desk gaming chair")
                    .filter("category", "office")
                    .filter("style", "gaming")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(i\\s*have\\s*(a\\s*)?(cat|dog|pet|puppy|kitten)s?|(cat|dog|pet)\\s*(scratch(es|ing)?|chew(s|ing)?|fur|hair|proof|friendly)|pet\\s*proof)\\b")
                    .intent("pet friendly, durable furniture")
                    .query("pet friendly scratch resistant durable")
                    .filter("material", "leather")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(sit\\s*stand|standing\\s*(up|desk)?|not\\s*sitting|on\\s*my\\s*feet)\\b")
                    .intent("a standing desk")
                    .query("adjustable standing desk sit stand")
                    .filter("category", "desks")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(man\\s*cave|game\\s*room|home\\s*theat(er|re)|cinema|movie\\s*night)\\b")
                    .intent("entertainment room furniture")
                    .query("recliner tv unit entertainment")
                    .filter("room_type", "living_room")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(work(ing)?\\s*from\\s*home|wfh|remote\\s*work(er)?|zoom\\s*calls?|hybrid\\s*work)\\b")
                    .intent("a home office setup")
                    .query("home office desk ergonomic chair")
                    .filter("room_type", "office")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(part(y|ies)|entertaining|dinner\\s*party|hosting)\\b")
                    .intent("furniture for entertaining guests")
                    .query("large dining table bar stool")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(kids?|children|toddler|baby|nursery|playroom)\\b")
                    .intent("child friendly furniture")
                    .query("kids furniture safe rounded edges")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(workout|exercise|fitness|training|weights)\\b")
                    .intent("home gym equipment")
                    .query("gym equipment fitness training")
                    .filter("category", "fitness")
                    .build(),
            VagueRule.builder().category(VagueCategory.LIFESTYLE_CONTEXT)
                    .regex("\\b(guests?|spare\\s*room|visitors?|in-laws?|overnight)\\b")
                    .intent("guest room furniture")
                    .query("sofa bed foldable mattress")
                    .filter("category", "bedroom")
                    .build(),

            // ==================== Negation / Complexity ====================

            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(not|no|without|isn'?t|aren'?t|don'?t\\s*want)\\s*(made\\s*of\\s*)?wood(en)?\\b")
                    .intent("non-wood materials")
                    .query("metal glass")
                    .filter("material", "metal")
                    .exclude("wood")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(no|without|don'?t\\s*want)\\s*wheels?\\b")
                    .intent("stationary furniture without wheels")
                    .query("stationary fixed base")
                    .exclude("wheels")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(not|no|without|isn'?t|aren'?t|don'?t\\s*want)\\s*leather\\b")
                    .intent("non-leather materials")
                    .query("fabric mesh velvet")
                    .filter("material", "fabric")
                    .exclude("leather")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(not|no|without|don'?t\\s*want)\\s*plastic\\b")
                    .intent("non-plastic materials")
                    .query("wood metal glass")
                    .filter("material", "wood")
                    .exclude("plastic")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(not|no|without|anything\\s*but)\\s*fabric\\b")
                    .intent("non-fabric materials")
                    .query("leather metal wood")
                    .filter("material", "leather")
                    .exclude("fabric")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b(not\\s*(too\\s*)?expensive|reasonably\\s*priced)\\b")
                    .intent("moderately priced items")
                    .query("affordable mid range value")
                    .filter("sort_by", "price_low")
                    .build(),
            VagueRule.builder().category(VagueCategory.NEGATION_COMPLEXITY)
                    .regex("\\b\\w+\\s+and\\s+\\w+\\s+(for\\s+)?(under|below|less\\s+than|within)\\s+\\$?\\d+\\b")
                    .intent("several items within one total budget")
                    .tool(SuggestedTool.BUILD_BUNDLE)
                    .build(),

            // ==================== Sentiment / Action ====================

            VagueRule.builder().category(VagueCategory.SENTIMENT_ACTION)
                    .regex("\\b(hate|hated|terrible|awful|worst|return|refund|money\\s*back|regret)\\b")
                    .intent("help with a return")
                    .tool(SuggestedTool.GET_POLICY_INFO)
                    .toolArg("policy_type", "returns")
                    .build(),
            VagueRule.builder().category(VagueCategory.SENTIMENT_ACTION)
                    .regex("\\b(when\\s*(will|does)\\s*(it|my\\s*order)\\s*(arrive|come)|how\\s*long\\s*(is|does)\\s*(shipping|delivery)|delivery|shipping|eta|tracking)\\b")
                    .intent("delivery information")
                    .tool(SuggestedTool.GET_POLICY_INFO)
                    .toolArg("policy_type", "shipping")
                    .build(),
            VagueRule.builder().category(VagueCategory.SENTIMENT_ACTION)
                    .regex("\\b(payment\\s*plan|instal+ments?|afterpay|zip\\s*pay|lay\\s*by|finance|pay\\s*later)\\b")
                    .intent("payment options")
                    .tool(SuggestedTool.GET_POLICY_INFO)
                    .toolArg("policy_type", "payment")
                    .build()
    );
}
