package com.retail.billkeeper.service;

import com.retail.billkeeper.config.NumberingProperties;
import com.retail.billkeeper.model.DocumentType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Maps a record type and date to its number series prefix.
 */
@Component
public class SeriesPrefixResolver {

    private final NumberingProperties properties;

    public SeriesPrefixResolver(NumberingProperties properties) {
        this.properties = properties;
    }

    public String documentPrefix(DocumentType type, LocalDate date) {
        String base = type == DocumentType.INVOICE ? properties.getInvoicePrefix() : properties.getChallanPrefix();
        return withDate(base, properties.getDocumentDatePattern(), date);
    }

    public String paymentPrefix(LocalDate date) {
        return withDate(properties.getPaymentPrefix(), properties.getChildDatePattern(), date);
    }

    public String returnPrefix(LocalDate date) {
        return withDate(properties.getReturnPrefix(), properties.getChildDatePattern(), date);
    }

    private String withDate(String base, String pattern, LocalDate date) {
        if (pattern == null || pattern.isBlank()) {
            return base;
        }
        return base + "-" + date.format(DateTimeFormatter.ofPattern(pattern));
    }
}
