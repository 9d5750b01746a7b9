package org.calista.formal.lang.commit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds an ordered list of leaf contents into one root fingerprint.
 *
 * <p>Leaves are hashed with full SHA-256, adjacent hashes are paired as {@code H(left + right)}
 * (the last one is paired with itself when the level is odd) until one remains, and the root
 * is truncated to the fingerprint length. An empty list yields the all-zero sentinel.
 * Reordering the leaves changes the root.</p>
 */
public final class MerkleCompressor {

    private final Fingerprinter fingerprinter;

    public MerkleCompressor(Fingerprinter fingerprinter) {
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
    }

    /**
     * @param leaves canonical leaf contents, in order
     */
    public String root(List<String> leaves) {
        Objects.requireNonNull(leaves, "leaves");
        if (leaves.isEmpty()) return fingerprinter.zero();

        List<String> level = new ArrayList<>(leaves.size());
        for (String leaf : leaves) level.add(Fingerprinter.sha256Hex(leaf));

        while (level.size() > 1) {
            List<String> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                next.add(Fingerprinter.sha256Hex(left + right));
            }
            level = next;
        }
        return fingerprinter.truncate(level.get(0));
    }
}
