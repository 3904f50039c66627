package org.netpreserve.evidence.store;

import java.util.List;

/**
 * Outcome of re-hashing the store's payloads.
 *
 * @param valid   payloads whose content matches their digest
 * @param missing digests indexed without a file
 * @param corrupt digests whose file is unreadable or hashes to something else
 */
public record StoreVerification(int valid, List<String> missing, List<String> corrupt) {
    public StoreVerification {
        missing = List.copyOf(missing);
        corrupt = List.copyOf(corrupt);
    }

    public boolean isClean() {
        return missing.isEmpty() && corrupt.isEmpty();
    }
}
