package com.delta.marketloader.ingest.source;

import java.util.Map;

public interface SourceFetchAdapter {

    DataSource source();

    /**
     * Fetches the raw payload for a vendor specific identifier.
     *
     * @throws SourceFetchException classified failure
     */
    SourcePayload fetch(String sourceIdentifier);

    /**
     * Vendor symbol listing, upper-case symbol to vendor identifier. When a symbol is
     * listed more than once the first entry wins.
     *
     * @throws SourceFetchException classified failure, UNSUPPORTED when the vendor has no listing
     */
    default Map<String, String> symbolCatalog() {
        throw SourceFetchException.unsupported(source(), "no symbol catalog");
    }
}
