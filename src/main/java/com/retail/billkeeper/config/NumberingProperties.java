package com.retail.billkeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Number series configuration. A full number reads
 * {@code PREFIX-SEQ}, e.g. {@code INV-000042} or {@code PAY-202610-000007}.
 */
@Data
@ConfigurationProperties(prefix = "billkeeper.numbering")
public class NumberingProperties {

    /** Attempts per number before giving up with NumberGenerationExhaustedException. */
    private int maxAttempts = 5;

    /** Base pause between attempts; grows linearly with the attempt number, plus jitter. */
    private Duration retryBackoff = Duration.ofMillis(5);

    /** Zero-padding width of the sequence part. */
    private int sequenceWidth = 6;

    private String invoicePrefix = "INV";
    private String challanPrefix = "CHN";
    private String paymentPrefix = "PAY";
    private String returnPrefix = "RET";
    private String itemPrefix = "ITM";

    /** Optional date suffix for invoice and challan prefixes; blank keeps one series forever. */
    private String documentDatePattern = "";

    /** Date suffix for payment and return prefixes. */
    private String childDatePattern = "yyyyMM";
}
