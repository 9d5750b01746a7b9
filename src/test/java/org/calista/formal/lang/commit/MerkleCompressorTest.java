package org.calista.formal.lang.commit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MerkleCompressorTest {

    private final Fingerprinter fp = new Fingerprinter();
    private final MerkleCompressor merkle = new MerkleCompressor(fp);

    @Test
    void emptyLeavesGiveZeroSentinel() {
        assertThat(merkle.root(List.of())).isEqualTo("0000000000000000");
    }

    @Test
    void singleLeafIsItsOwnDigest() {
        assertThat(merkle.root(List.of("abc")))
                .isEqualTo("ba7816bf8f01cfea");
    }

    @Test
    void oddLevelDuplicatesLastHash() {
        String a = Fingerprinter.sha256Hex("a");
        String b = Fingerprinter.sha256Hex("b");
        String c = Fingerprinter.sha256Hex("c");
        String left = Fingerprinter.sha256Hex(a + b);
        String right = Fingerprinter.sha256Hex(c + c);
        String expected = Fingerprinter.sha256Hex(left + right).substring(0, 16);

        assertThat(merkle.root(List.of("a", "b", "c"))).isEqualTo(expected);
    }

    @Test
    void rootIsOrderSensitive() {
        assertThat(merkle.root(List.of("a", "b"))).isNotEqualTo(merkle.root(List.of("b", "a")));
    }

    @Test
    void rootFollowsConfiguredLength() {
        MerkleCompressor wide = new MerkleCompressor(new Fingerprinter(32));
        assertThat(wide.root(List.of())).hasSize(32).matches("0+");
        assertThat(wide.root(List.of("abc"))).isEqualTo("ba7816bf8f01cfea414140de5dae2223");
    }

    @Test
    void fingerprintLengthIsBounded() {
        assertThatThrownBy(() -> new Fingerprinter(7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Fingerprinter(65)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sha256MatchesKnownVector() {
        assertThat(Fingerprinter.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(Fingerprinter.isHex("ba78")).isTrue();
        assertThat(Fingerprinter.isHex("xyz")).isFalse();
    }
}
