package com.shoptalk.catalog;

import com.shoptalk.catalog.model.Product;

import java.math.BigDecimal;
import java.util.List;

public final class CatalogFixtures {

    private CatalogFixtures() {}

    public static Product product(String id, String title, String category, String price, String... tags) {
        return Product.builder()
                .id(id)
                .sku("SKU-" + id)
                .title(title)
                .description(title + " for everyday use")
                .category(category)
                .tags(List.of(tags))
                .price(new BigDecimal(price))
                .inventoryQuantity(5)
                .available(true)
                .build();
    }

    public static List<Product> furniture() {
        return List.of(
                product("artiss-1", "Artiss Office Chair Gaming Computer Mesh Chairs Executive Seat", "Chairs",
                        "129.95", "Color_Black", "mesh"),
                product("desk-1", "Artiss Standing Desk Sit Stand Motorised Frame", "Desks", "299.00", "Color_White"),
                product("table-1", "Oak Dining Table 6 Seater", "Tables", "450.00", "Color_Brown", "wood"),
                product("chair-2", "Wooden Dining Chair Set of 2", "Chairs", "89.00", "Color_Brown", "wood"),
                product("cage-1", "Bird Cage Parrot Aviary Large", "Bird Cages & Stands", "199.00"),
                product("velvet-1", "Velvet Accent Chair", "Chairs", "149.00", "Color_Green")
                        .toBuilder().available(false).inventoryQuantity(0).build());
    }
}
