package com.shoptalk.assistant.reply;

import com.shoptalk.assistant.bundle.BundleLine;
import com.shoptalk.assistant.bundle.BundlePlan;
import com.shoptalk.assistant.lookup.ProductAvailability;
import com.shoptalk.catalog.model.Product;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Deterministic replies built from fixed sentences and the turn's products.
 */
@Component
public class TemplateReplyComposer implements ReplyComposer {

    static final String GREETING = "Hi! I can help you find furniture, office gear, pet supplies and fitness "
            + "equipment. What are you shopping for today?";

    static final String HELP = "Tell me what you need in your own words, for example \"a comfy chair for my "
            + "home office under $300\" or \"everything I need for a new puppy\". You can refer to results by "
            + "number (\"tell me about option 2\") or ask me to compare them.";

    static final String CATALOG_NOT_READY = "Our product catalog is still loading. Please try again in a moment.";

    @Override
    public String compose(ReplyContext context) {
        return switch (context.getKind()) {
            case GREETING -> GREETING;
            case HELP -> HELP;
            case CATALOG_NOT_READY -> CATALOG_NOT_READY;
            case CLARIFICATION -> context.getClarificationMessage();
            case POLICY -> context.getPolicyText();
            case NO_RESULTS -> noResults(context);
            case NO_ATTRIBUTE_MATCH -> noAttributeMatch(context);
            case PRODUCTS -> products(context);
            case REFERENCE -> reference(context);
            case COMPARISON -> comparison(context);
            case AVAILABILITY -> availability(context.getAvailability());
            case SIMILAR -> similar(context);
            case BUNDLE -> bundle(context.getBundlePlan());
        };
    }

    // ==================== Product Replies ====================

    private String products(ReplyContext context) {
        StringBuilder reply = new StringBuilder();
        reply.append(unresolvedNote(context));
        List<Product> products = context.getProducts();
        reply.append("Here ").append(products.size() == 1 ? "is 1 option" : "are " + products.size() + " options")
                .append(" I found:");
        appendNumbered(reply, products);
        return reply.toString();
    }

    private String reference(ReplyContext context) {
        List<Product> products = context.getProducts();
        if (products.size() == 1) {
            Product product = products.get(0);
            StringBuilder reply = new StringBuilder();
            reply.append(product.getTitle()).append(" is ").append(price(product.priceOrZero()));
            if (product.getDescription() != null && !product.getDescription().isBlank()) {
                reply.append(". ").append(product.getDescription().trim());
            }
            reply.append(product.isInStock() ? " It is in stock." : " It is currently out of stock.");
            return reply.toString();
        }
        StringBuilder reply = new StringBuilder("Here are the products you mentioned:");
        appendNumbered(reply, products);
        return reply.toString();
    }

    private String comparison(ReplyContext context) {
        List<Product> products = context.getProducts();
        if (products.isEmpty()) {
            return "I don't have any products to compare yet. What would you like me to search for?";
        }
        StringBuilder reply = new StringBuilder("Comparing ").append(products.size()).append(" products:");
        for (Product product : products) {
            reply.append("\n- ").append(product.getTitle())
                    .append(": ").append(price(product.priceOrZero()))
                    .append(product.getSubcategory() != null ? ", " + product.getSubcategory() : "")
                    .append(product.isInStock() ? ", in stock" : ", out of stock");
        }
        Product cheapest = products.stream()
                .min((a, b) -> a.priceOrZero().compareTo(b.priceOrZero()))
                .orElseThrow();
        reply.append("\nThe most affordable is ").append(cheapest.getTitle()).append('.');
        return reply.toString();
    }

    private String similar(ReplyContext context) {
        StringBuilder reply = new StringBuilder("Here are some options similar to ")
                .append(context.getSimilarTo().getTitle()).append(':');
        appendNumbered(reply, context.getProducts());
        return reply.toString();
    }

    private String availability(List<ProductAvailability> statuses) {
        if (statuses.size() == 1) {
            return stockSentence(statuses.get(0));
        }
        StringBuilder reply = new StringBuilder("Here is what we have in stock:");
        for (ProductAvailability status : statuses) {
            reply.append("\n- ").append(stockSentence(status));
        }
        return reply.toString();
    }

    private static String stockSentence(ProductAvailability status) {
        String title = status.product().getTitle();
        if (!status.listed()) {
            return title + " is no longer in our catalog.";
        }
        if (!status.inStock()) {
            return title + " is currently out of stock.";
        }
        StringBuilder sentence = new StringBuilder(title);
        if (status.lowStock()) {
            sentence.append(" is in stock, but only ").append(status.quantityAvailable()).append(" left.");
        } else if (status.quantityAvailable() > 0) {
            sentence.append(" is in stock (").append(status.quantityAvailable()).append(" available).");
        } else {
            sentence.append(" is in stock.");
        }
        sentence.append(" Estimated delivery: ").append(status.estimatedDelivery()).append('.');
        return sentence.toString();
    }

    private String noResults(ReplyContext context) {
        return unresolvedNote(context) + "I couldn't find anything matching \"" + context.getQuery()
                + "\". Could you try different words, or tell me more about what you need?";
    }

    private String noAttributeMatch(ReplyContext context) {
        StringBuilder reply = new StringBuilder("I couldn't find that in ")
                .append(context.getRequestedValue()).append('.');
        if (!context.getAvailableValues().isEmpty()) {
            reply.append(" It is available in ")
                    .append(String.join(", ", context.getAvailableValues()))
                    .append(". Would any of those work?");
        }
        return reply.toString();
    }

    // ==================== Bundle Replies ====================

    private String bundle(BundlePlan plan) {
        StringBuilder reply = new StringBuilder();
        if (plan.getItems().isEmpty()) {
            reply.append("I couldn't put that bundle together from what is in stock right now.");
        } else {
            reply.append("Here is a bundle for you:");
            for (BundleLine line : plan.getItems()) {
                reply.append("\n- ").append(line.getProduct().getTitle());
                if (line.getQuantity() > 1) {
                    reply.append(" x").append(line.getQuantity());
                }
                reply.append(": ").append(price(line.getLineTotal()));
            }
            reply.append("\nTotal: ").append(price(plan.getTotalCost()));
            if (plan.getBudget() != null) {
                reply.append(" (budget ").append(price(plan.getBudget())).append(')');
            }
        }
        if (!plan.isFeasible()) {
            reply.append("\nThe essentials come to ").append(price(plan.getBudgetShortfall()))
                    .append(" over your budget.");
        }
        if (!plan.getUnmetItemTypes().isEmpty()) {
            reply.append("\nI couldn't find: ").append(readable(plan.getUnmetItemTypes())).append('.');
        }
        if (!plan.getSkippedOptionalItemTypes().isEmpty()) {
            reply.append("\nLeft out to stay on budget or out of stock: ")
                    .append(readable(plan.getSkippedOptionalItemTypes())).append('.');
        }
        return reply.toString();
    }

    // ==================== Helper Methods ====================

    private static void appendNumbered(StringBuilder reply, List<Product> products) {
        for (int i = 0; i < products.size(); i++) {
            Product product = products.get(i);
            reply.append('\n').append(i + 1).append(". ").append(product.getTitle())
                    .append(" - ").append(price(product.priceOrZero()));
        }
    }

    private static String unresolvedNote(ReplyContext context) {
        if (context.getUnresolvedReferences().isEmpty()) {
            return "";
        }
        return "I couldn't match \"" + String.join("\", \"", context.getUnresolvedReferences())
                + "\" to the products I showed, so I searched again. ";
    }

    private static String readable(Iterable<String> itemTypes) {
        StringBuilder text = new StringBuilder();
        for (String itemType : itemTypes) {
            if (text.length() > 0) {
                text.append(", ");
            }
            text.append(itemType.replace('_', ' '));
        }
        return text.toString();
    }

    static String price(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
