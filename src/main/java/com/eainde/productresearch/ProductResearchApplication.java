package com.eainde.productresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Product image research application.
 *
 * <p>Usage:
 * <pre>{@code
 *   java -jar product-research.jar --barcode=012345678905 --sku=AB-12345 --title="Some product"
 * }</pre>
 * Without identifier options the context starts and exits without running a search.</p>
 */
@SpringBootApplication
public class ProductResearchApplication {

    public static void main(final String[] args) {
        SpringApplication.run(ProductResearchApplication.class, args);
    }
}
