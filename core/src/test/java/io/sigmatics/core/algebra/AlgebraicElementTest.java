package io.sigmatics.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sigmatics.core.error.NegativePowerException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link AlgebraicElement}. */
class AlgebraicElementTest {

    private static final AlgebraicElement COMPOSITE = AlgebraicElement.of(
            1, 2, Multivector.of(Map.of(Blade.SCALAR, 2, Blade.of(3), 1, Blade.of(1, 5), -4)));

    private static final List<AlgebraicElement> SAMPLES = List.of(
            AlgebraicElement.identity(),
            AlgebraicElement.rank1(3, 1, 6),
            COMPOSITE);

    @Test
    void constantsAreDistinguished() {
        assertThat(AlgebraicElement.zero().isZero()).isTrue();
        assertThat(AlgebraicElement.identity().isIdentity()).isTrue();
        assertThat(AlgebraicElement.identity()).isNotEqualTo(AlgebraicElement.zero());
    }

    @Test
    void multiplicationAddsGroupCoordinates() {
        AlgebraicElement a = AlgebraicElement.rank1(3, 2, 0);
        AlgebraicElement b = AlgebraicElement.rank1(2, 2, 0);
        AlgebraicElement product = a.multiply(b);
        assertThat(product.z4()).isEqualTo(1);
        assertThat(product.z3()).isEqualTo(1);
        assertThat(product.clifford()).isEqualTo(Multivector.one());
    }

    @Test
    void identityIsNeutral() {
        for (AlgebraicElement e : SAMPLES) {
            assertThat(AlgebraicElement.identity().multiply(e)).isEqualTo(e);
            assertThat(e.multiply(AlgebraicElement.identity())).isEqualTo(e);
        }
    }

    @Test
    void equalityComparesAllThreeCoordinates() {
        AlgebraicElement base = AlgebraicElement.rank1(1, 1, 1);
        assertThat(base).isEqualTo(AlgebraicElement.rank1(1, 1, 1));
        assertThat(base).hasSameHashCodeAs(AlgebraicElement.rank1(1, 1, 1));
        assertThat(base).isNotEqualTo(AlgebraicElement.rank1(2, 1, 1));
        assertThat(base).isNotEqualTo(AlgebraicElement.rank1(1, 2, 1));
        assertThat(base).isNotEqualTo(AlgebraicElement.rank1(1, 1, 2));
    }

    // --- Power ---

    @Test
    void powerZeroIsIdentity() {
        assertThat(COMPOSITE.power(0)).isEqualTo(AlgebraicElement.identity());
    }

    @Test
    void powerIsRepeatedProduct() {
        AlgebraicElement e5 = AlgebraicElement.rank1(1, 1, 5);
        assertThat(e5.power(1)).isEqualTo(e5);
        assertThat(e5.power(2)).isEqualTo(AlgebraicElement.of(2, 2, Multivector.scalar(-1)));
        assertThat(e5.power(4)).isEqualTo(AlgebraicElement.of(0, 1, Multivector.one()));
        assertThat(e5.power(3)).isEqualTo(e5.power(2).multiply(e5));
    }

    @Test
    void negativePowerFails() {
        assertThatThrownBy(() -> COMPOSITE.power(-1))
                .isInstanceOf(NegativePowerException.class)
                .hasMessageContaining("Negative powers");
    }

    // --- Involutions ---

    @Test
    void involutionsApplyTwiceToIdentity() {
        for (AlgebraicElement e : SAMPLES) {
            assertThat(e.gradeInvolution().gradeInvolution()).isEqualTo(e);
            assertThat(e.reversion().reversion()).isEqualTo(e);
            assertThat(e.cliffordConjugation().cliffordConjugation()).isEqualTo(e);
        }
    }

    @Test
    void involutionsKeepGroupCoordinates() {
        AlgebraicElement r = COMPOSITE.reversion();
        assertThat(r.z4()).isEqualTo(1);
        assertThat(r.z3()).isEqualTo(2);
    }

    // --- Linear structure ---

    @Test
    void addRequiresMatchingGroupCoordinates() {
        AlgebraicElement a = AlgebraicElement.rank1(1, 1, 1);
        AlgebraicElement b = AlgebraicElement.rank1(1, 1, 2);
        assertThat(a.add(b).clifford()).isEqualTo(Multivector.basis(1).add(Multivector.basis(2)));
        assertThatThrownBy(() -> a.add(AlgebraicElement.rank1(2, 1, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scaleMultipliesCoefficients() {
        assertThat(AlgebraicElement.rank1(0, 0, 3).scale(2).clifford())
                .isEqualTo(Multivector.term(Blade.generator(3), 2));
        assertThat(AlgebraicElement.rank1(0, 0, 3).scale(0).isZero()).isTrue();
    }

    // --- Rank-1 ---

    @Test
    void rank1RecognizesLiftImagesOnly() {
        assertThat(AlgebraicElement.rank1(2, 1, 0).isRank1()).isTrue();
        assertThat(AlgebraicElement.rank1(2, 1, 7).isRank1()).isTrue();
        assertThat(COMPOSITE.isRank1()).isFalse();
        assertThat(AlgebraicElement.rank1(0, 0, 3).scale(2).isRank1()).isFalse();
        assertThat(AlgebraicElement.of(0, 0, Multivector.term(Blade.of(1, 2), 1)).isRank1()).isFalse();
        assertThat(AlgebraicElement.zero().isRank1()).isFalse();
    }

    @Test
    void rendersForDiagnostics() {
        assertThat(AlgebraicElement.rank1(1, 2, 3)).hasToString("r^1 (x) tau^2 (x) (e3)");
        assertThat(AlgebraicElement.identity()).hasToString("r^0 (x) tau^0 (x) (1)");
    }
}
