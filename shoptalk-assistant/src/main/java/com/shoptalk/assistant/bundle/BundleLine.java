package com.shoptalk.assistant.bundle;

import com.shoptalk.catalog.model.Product;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@Builder
@ToString
public class BundleLine {

    private final String itemType;
    private final Product product;
    private final BigDecimal unitPrice;
    private final int quantity;
    private final BigDecimal lineTotal;
    private final boolean required;
}
