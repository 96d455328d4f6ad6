package com.delta.marketloader.ingest.identifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Issues identifiers for one security type, continuing after the highest sequence already
 * persisted.
 *
 * <p>The counter is owned by this instance and is not coordinated across processes: two
 * generators seeded from the same table will hand out the same sequence numbers.
 */
public class IdGenerator {
    private static final Logger log = LoggerFactory.getLogger(IdGenerator.class);

    private final SecurityType type;
    private long nextSequence;

    /**
     * @param type the type to issue identifiers for
     * @param existingIds persisted identifiers of that type; values that decode to a different
     *     type are ignored
     */
    public IdGenerator(SecurityType type, Iterable<Long> existingIds) {
        this.type = Objects.requireNonNull(type, "type");
        long max = 0;
        int scanned = 0;
        int ignored = 0;
        if (existingIds != null) {
            for (Long id : existingIds) {
                if (id == null) {
                    continue;
                }
                scanned++;
                SecurityIdentifier identifier = IdentifierCodec.decode(id);
                if (identifier.type() != type) {
                    ignored++;
                    continue;
                }
                max = Math.max(max, identifier.sequence());
            }
        }
        this.nextSequence = max + 1;
        if (ignored > 0) {
            log.warn("Ignored {} identifiers of another type while seeding {} generator", ignored, type);
        }
        log.debug("{} generator seeded from {} identifiers, next sequence {}", type, scanned, nextSequence);
    }

    public SecurityType type() {
        return type;
    }

    public long peekNextSequence() {
        return nextSequence;
    }

    public long next() {
        if (nextSequence > IdentifierCodec.maxSequence(type)) {
            throw new IllegalStateException("identifier space exhausted for " + type);
        }
        long id = IdentifierCodec.encode(type, nextSequence);
        nextSequence++;
        return id;
    }
}
