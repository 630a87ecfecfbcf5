package com.libragraph.odfpack.container.store;

import com.libragraph.odfpack.types.PartState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PartEntryTest {

    @Test
    void shouldBuildEntriesPerState() {
        assertThat(PartEntry.loaded(new byte[]{1}, 10).state()).isEqualTo(PartState.LOADED);
        assertThat(PartEntry.assigned(new byte[]{1}).hasTimestamp()).isFalse();
        assertThat(PartEntry.synthesized(new byte[]{1}, 10).state()).isEqualTo(PartState.ASSIGNED);
        assertThat(PartEntry.synthesized(new byte[]{1}, 10).hasTimestamp()).isTrue();
        assertThat(PartEntry.deleted().isDeleted()).isTrue();
        assertThat(PartEntry.deleted().data()).isNull();
    }

    @Test
    void shouldRejectInconsistentEntries() {
        assertThatThrownBy(() -> new PartEntry(PartState.ABSENT, null, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartEntry(PartState.LOADED, null, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PartEntry(PartState.DELETED, new byte[0], -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDuplicateBytesOnCopy() {
        PartEntry entry = PartEntry.loaded(new byte[]{1, 2}, 5);

        PartEntry copy = entry.copy();

        assertThat(copy.data()).isNotSameAs(entry.data()).containsExactly(1, 2);
        assertThat(copy.timestamp()).isEqualTo(5);
        assertThat(PartEntry.deleted().copy()).isSameAs(PartEntry.deleted());
    }
}
