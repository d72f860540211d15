package com.retail.billkeeper.service;

import com.retail.billkeeper.config.NumberingProperties;
import com.retail.billkeeper.model.DocumentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SeriesPrefixResolverTest {

    private NumberingProperties properties;
    private SeriesPrefixResolver resolver;

    private static final LocalDate OCT_16 = LocalDate.of(2026, 10, 16);

    @BeforeEach
    void setUp() {
        properties = new NumberingProperties();
        resolver = new SeriesPrefixResolver(properties);
    }

    @Test
    void documentPrefix_ShouldUseOneSeriesPerType_ByDefault() {
        assertEquals("INV", resolver.documentPrefix(DocumentType.INVOICE, OCT_16));
        assertEquals("CHN", resolver.documentPrefix(DocumentType.CHALLAN, OCT_16));
    }

    @Test
    void documentPrefix_ShouldAppendDate_WhenPatternConfigured() {
        properties.setDocumentDatePattern("yyyy");

        assertEquals("INV-2026", resolver.documentPrefix(DocumentType.INVOICE, OCT_16));
    }

    @Test
    void childPrefixes_ShouldStartNewSeriesEachMonth() {
        assertEquals("PAY-202610", resolver.paymentPrefix(OCT_16));
        assertEquals("RET-202610", resolver.returnPrefix(OCT_16));
        assertEquals("PAY-202611", resolver.paymentPrefix(LocalDate.of(2026, 11, 1)));
    }
}
