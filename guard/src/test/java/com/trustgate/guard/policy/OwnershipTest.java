package com.trustgate.guard.policy;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OwnershipTest {

    @Test
    void ownership_closedOverTwoVariants() {
        assertThat(Ownership.class.isSealed()).isTrue();
        assertThat(Ownership.class.getPermittedSubclasses())
                .containsExactlyInAnyOrder(Ownership.Unrestricted.class, Ownership.RestrictedTo.class);
    }

    @Test
    void unrestricted_permitsAnyPath() {
        Ownership ownership = Ownership.unrestricted();

        assertThat(ownership.isUnrestricted()).isTrue();
        assertThat(ownership.permits(Path.of("/anywhere/at/all"))).isTrue();
    }

    @Test
    void restrictedTo_emptySet_permitsNothing() {
        Ownership ownership = Ownership.restrictedTo(Set.of());

        assertThat(ownership).isInstanceOf(Ownership.RestrictedTo.class);
        assertThat(ownership.isUnrestricted()).isFalse();
        assertThat(ownership.permits(Path.of("/work/app.py"))).isFalse();
    }

    @Test
    void restrictedTo_pathsSortedForMessages() {
        Ownership.RestrictedTo ownership = (Ownership.RestrictedTo) Ownership.restrictedTo(
                Set.of(Path.of("/work/b.py"), Path.of("/work/a.py")));

        assertThat(ownership.paths()).containsExactly(Path.of("/work/a.py"), Path.of("/work/b.py"));
        assertThat(ownership.permits(Path.of("/work/a.py"))).isTrue();
    }
}
