package com.delta.marketloader.ingest.identifier;

import java.util.Locale;
import java.util.Map;

/**
 * Entity universes that share the 64-bit identifier space.
 *
 * <p>This enum is the single prefix registry: each type declares how many high bits its tag
 * occupies and the tag value itself. Large universes get a 4-bit tag (60 bits of sequence),
 * medium ones 5 bits and small ones 6 bits. {@link IdentifierCodec} validates the table when it
 * is first loaded.
 */
public enum SecurityType {
    EQUITY(4, 0b0000, "Common Stock"),
    PREFERRED_STOCK(4, 0b0001, "Preferred Stock"),
    ETF(4, 0b0010, "ETF"),
    MUTUAL_FUND(4, 0b0011, "Mutual Fund"),
    OPTION(4, 0b0100, "Option"),
    FUTURE(4, 0b0101, "Future"),
    WARRANT(4, 0b0110, "Warrant"),
    ADR(4, 0b0111, "ADR"),

    BOND(5, 0b10000, "Bond"),
    GOVERNMENT_BOND(5, 0b10001, "Government Bond"),
    CORPORATE_BOND(5, 0b10010, "Corporate Bond"),
    MUNICIPAL_BOND(5, 0b10011, "Municipal Bond"),
    CRYPTOCURRENCY(5, 0b10100, "Cryptocurrency"),
    REIT(5, 0b10101, "REIT"),

    CURRENCY(6, 0b110000, "Currency"),
    INDEX(6, 0b110001, "Index"),
    COMMODITY(6, 0b110010, "Commodity"),
    CD(6, 0b110011, "Certificate of Deposit"),
    TREASURY_BILL(6, 0b110100, "Treasury Bill"),
    OTHER(6, 0b111111, "Other");

    private static final Map<String, SecurityType> LABELS = Map.ofEntries(
        Map.entry("EQUITY", EQUITY),
        Map.entry("CS", EQUITY),
        Map.entry("STOCK", EQUITY),
        Map.entry("COMMONSTOCK", EQUITY),
        Map.entry("PREFERREDSTOCK", PREFERRED_STOCK),
        Map.entry("PREFERRED", PREFERRED_STOCK),
        Map.entry("PS", PREFERRED_STOCK),
        Map.entry("ETF", ETF),
        Map.entry("EXCHANGETRADEDFUND", ETF),
        Map.entry("MUTUALFUND", MUTUAL_FUND),
        Map.entry("MF", MUTUAL_FUND),
        Map.entry("FUND", MUTUAL_FUND),
        Map.entry("OPTION", OPTION),
        Map.entry("FUTURE", FUTURE),
        Map.entry("FUTURES", FUTURE),
        Map.entry("WARRANT", WARRANT),
        Map.entry("WT", WARRANT),
        Map.entry("ADR", ADR),
        Map.entry("AMERICANDEPOSITARYRECEIPT", ADR),
        Map.entry("BOND", BOND),
        Map.entry("GOVERNMENTBOND", GOVERNMENT_BOND),
        Map.entry("GOVBOND", GOVERNMENT_BOND),
        Map.entry("CORPORATEBOND", CORPORATE_BOND),
        Map.entry("CORPBOND", CORPORATE_BOND),
        Map.entry("MUNICIPALBOND", MUNICIPAL_BOND),
        Map.entry("MUNIBOND", MUNICIPAL_BOND),
        Map.entry("CRYPTOCURRENCY", CRYPTOCURRENCY),
        Map.entry("CRYPTO", CRYPTOCURRENCY),
        Map.entry("DIGITALCURRENCY", CRYPTOCURRENCY),
        Map.entry("REIT", REIT),
        Map.entry("REALESTATEINVESTMENTTRUST", REIT),
        Map.entry("CURRENCY", CURRENCY),
        Map.entry("FX", CURRENCY),
        Map.entry("FOREX", CURRENCY),
        Map.entry("INDEX", INDEX),
        Map.entry("COMMODITY", COMMODITY),
        Map.entry("CD", CD),
        Map.entry("CERTIFICATEOFDEPOSIT", CD),
        Map.entry("TREASURYBILL", TREASURY_BILL),
        Map.entry("TBILL", TREASURY_BILL)
    );

    private final int prefixWidth;
    private final int prefix;
    private final String displayName;

    SecurityType(int prefixWidth, int prefix, String displayName) {
        this.prefixWidth = prefixWidth;
        this.prefix = prefix;
        this.displayName = displayName;
    }

    public int prefixWidth() {
        return prefixWidth;
    }

    public int prefix() {
        return prefix;
    }

    /** Number of low bits left for the sequence number. */
    public int sequenceBits() {
        return Long.SIZE - prefixWidth;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Maps a vendor or file label ("Common Stock", "crypto", "FX") to a type. Unknown or blank
     * labels map to {@link #OTHER}.
     */
    public static SecurityType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s_\\-]", "");
        return LABELS.getOrDefault(normalized, OTHER);
    }
}
