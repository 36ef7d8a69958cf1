package com.flagship.pos_inventory.config;

import com.flagship.pos_inventory.posting.NextIdGenerator;
import com.flagship.pos_inventory.posting.SequenceNextIdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Document number generators for sales and purchases.
 */
@Configuration
public class IdGeneratorConfig {

    public static final String INVOICE_NO_GENERATOR = "invoiceNoGenerator";
    public static final String PURCHASE_NO_GENERATOR = "purchaseNoGenerator";

    @Bean(INVOICE_NO_GENERATOR)
    public NextIdGenerator invoiceNoGenerator(JdbcTemplate jdbcTemplate) {
        return new SequenceNextIdGenerator(jdbcTemplate, "invoice_no_seq", "INV");
    }

    @Bean(PURCHASE_NO_GENERATOR)
    public NextIdGenerator purchaseNoGenerator(JdbcTemplate jdbcTemplate) {
        return new SequenceNextIdGenerator(jdbcTemplate, "purchase_no_seq", "PUR");
    }
}
