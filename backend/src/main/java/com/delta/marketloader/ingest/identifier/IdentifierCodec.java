package com.delta.marketloader.ingest.identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Packs a (type, sequence) pair into one signed 64-bit identifier and back.
 *
 * <p>The type tag sits in the top 4, 5 or 6 bits and the sequence fills the rest. Decoding tests
 * the 4-bit table first, then 5, then 6, because the same high bits are read at different widths
 * for different classes. Any value decodes to some type; unmatched patterns become
 * {@link SecurityType#OTHER} with the 6-bit layout.
 */
public final class IdentifierCodec {
    private static final int[] PREFIX_WIDTHS = {4, 5, 6};
    private static final SecurityType[][] TABLES;

    static {
        List<PrefixSpec> specs = new ArrayList<>();
        for (SecurityType type : SecurityType.values()) {
            specs.add(new PrefixSpec(type.name(), type.prefixWidth(), type.prefix()));
        }
        validate(specs);

        TABLES = new SecurityType[PREFIX_WIDTHS.length][];
        for (int i = 0; i < PREFIX_WIDTHS.length; i++) {
            TABLES[i] = new SecurityType[1 << PREFIX_WIDTHS[i]];
        }
        for (SecurityType type : SecurityType.values()) {
            TABLES[tableIndex(type.prefixWidth())][type.prefix()] = type;
        }
    }

    private IdentifierCodec() {
    }

    public static long encode(SecurityType type, long sequence) {
        Objects.requireNonNull(type, "type");
        long max = maxSequence(type);
        if (sequence < 0 || sequence > max) {
            throw new IllegalArgumentException(
                "sequence " + sequence + " outside 0.." + max + " for " + type
            );
        }
        return ((long) type.prefix() << type.sequenceBits()) | sequence;
    }

    public static SecurityIdentifier decode(long id) {
        for (int width : PREFIX_WIDTHS) {
            int tag = (int) (id >>> (Long.SIZE - width));
            SecurityType type = TABLES[tableIndex(width)][tag];
            if (type != null) {
                return new SecurityIdentifier(type, id & maxSequence(type));
            }
        }
        return new SecurityIdentifier(SecurityType.OTHER, id & maxSequence(SecurityType.OTHER));
    }

    public static SecurityType decodeType(long id) {
        return decode(id).type();
    }

    public static long maxSequence(SecurityType type) {
        return (1L << type.sequenceBits()) - 1;
    }

    /** Smallest identifier carrying this type's tag. Tag blocks are contiguous in signed order. */
    public static long lowerBound(SecurityType type) {
        return encode(type, 0);
    }

    public static long upperBound(SecurityType type) {
        return encode(type, maxSequence(type));
    }

    /**
     * Rejects a prefix table where a tag does not fit its width, two tags repeat, or one tag is a
     * bit-prefix of another (which would make decoding ambiguous).
     */
    static void validate(List<PrefixSpec> specs) {
        for (PrefixSpec spec : specs) {
            if (tableIndexOrNegative(spec.width()) < 0) {
                throw new IllegalStateException("unsupported prefix width " + spec.width() + " for " + spec.name());
            }
            if (spec.prefix() < 0 || spec.prefix() >= (1 << spec.width())) {
                throw new IllegalStateException("prefix of " + spec.name() + " does not fit in " + spec.width() + " bits");
            }
        }
        for (int i = 0; i < specs.size(); i++) {
            for (int j = i + 1; j < specs.size(); j++) {
                PrefixSpec a = specs.get(i);
                PrefixSpec b = specs.get(j);
                PrefixSpec shorter = a.width() <= b.width() ? a : b;
                PrefixSpec longer = shorter == a ? b : a;
                int truncated = longer.prefix() >>> (longer.width() - shorter.width());
                if (truncated == shorter.prefix()) {
                    throw new IllegalStateException(
                        "identifier prefixes overlap: " + a.name() + " and " + b.name()
                    );
                }
            }
        }
    }

    private static int tableIndex(int width) {
        int index = tableIndexOrNegative(width);
        if (index < 0) {
            throw new IllegalArgumentException("unsupported prefix width " + width);
        }
        return index;
    }

    private static int tableIndexOrNegative(int width) {
        for (int i = 0; i < PREFIX_WIDTHS.length; i++) {
            if (PREFIX_WIDTHS[i] == width) {
                return i;
            }
        }
        return -1;
    }

    record PrefixSpec(String name, int width, int prefix) {
    }
}
