package com.shoptalk.assistant.reference;

import com.shoptalk.catalog.model.Product;

import java.util.List;

/**
 * A message with its positional references replaced by product tokens.
 *
 * @param rewrittenText the message with {@code [product:<id>]} tokens in place of resolved phrases
 * @param products the referenced products, in the order they appear in the message
 * @param unresolvedPhrases phrases pointing past the end of the shown list, left as written
 */
public record ResolvedReferences(String rewrittenText, List<Product> products, List<String> unresolvedPhrases) {

    public boolean rewroteAnything(String originalText) {
        return !rewrittenText.equals(originalText);
    }

    public boolean hasProducts() {
        return !products.isEmpty();
    }
}
