package io.weave.governance;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalStrategyTest {

    @Test
    void all_needsEveryApprover() {
        var turn = YieldTurn.create("x", "s", "r", Set.of("alice", "bob"));

        assertThat(ApprovalStrategy.ALL.isSatisfied(turn.approve("alice"))).isFalse();
        assertThat(ApprovalStrategy.ALL.isSatisfied(turn.approve("alice").approve("bob"))).isTrue();
    }

    @Test
    void any_needsOneApprover() {
        var turn = YieldTurn.create("x", "s", "r", Set.of("alice", "bob"));

        assertThat(ApprovalStrategy.ANY.isSatisfied(turn)).isFalse();
        assertThat(ApprovalStrategy.ANY.isSatisfied(turn.approve("alice"))).isTrue();
    }

    @Test
    void majority_needsStrictlyMoreThanHalf() {
        var three = YieldTurn.create("x", "s", "r", Set.of("a", "b", "c"));
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(three.approve("a"))).isFalse();
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(three.approve("a").approve("c"))).isTrue();

        var two = YieldTurn.create("x", "s", "r", Set.of("a", "b"));
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(two.approve("a"))).isFalse();
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(two.approve("a").approve("b"))).isTrue();

        var one = YieldTurn.create("x", "s", "r", Set.of("a"));
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(one)).isFalse();
        assertThat(ApprovalStrategy.MAJORITY.isSatisfied(one.approve("a"))).isTrue();
    }

    @Test
    void emptyRequiredSetSatisfiesEveryStrategy() {
        var free = YieldTurn.create("x", "s", "r", Set.of());

        for (var strategy : ApprovalStrategy.values()) {
            assertThat(strategy.isSatisfied(free)).as(strategy.name()).isTrue();
        }
    }
}
