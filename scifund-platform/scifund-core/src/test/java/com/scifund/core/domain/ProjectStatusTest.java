package com.scifund.core.domain;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectStatusTest {

    @Property
    void transitionsNeverGoBackwards(@ForAll ProjectStatus from, @ForAll ProjectStatus to) {
        if (from.canTransitionTo(to) && to != ProjectStatus.CANCELLED) {
            assertThat(to.ordinal()).isEqualTo(from.ordinal() + 1);
        }
    }

    @Property
    void terminalStatesAreAbsorbing(@ForAll ProjectStatus from, @ForAll ProjectStatus to) {
        if (from.isTerminal()) {
            assertThat(from.canTransitionTo(to)).isFalse();
        }
    }

    @Example
    void forwardPath() {
        assertThat(ProjectStatus.ACTIVE.canTransitionTo(ProjectStatus.FUNDED)).isTrue();
        assertThat(ProjectStatus.FUNDED.canTransitionTo(ProjectStatus.IN_PROGRESS)).isTrue();
        assertThat(ProjectStatus.ACTIVE.canTransitionTo(ProjectStatus.IN_PROGRESS)).isFalse();
        assertThat(ProjectStatus.IN_PROGRESS.canTransitionTo(ProjectStatus.FUNDED)).isFalse();
    }
}
